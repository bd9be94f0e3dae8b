package com.synesis.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synesis.loader.SynesisFixtures;
import com.synesis.loader.SynesisLoggingConfig;
import com.synesis.loader.ast.FieldValue;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.ItemFieldBinder.CodeReference;
import com.synesis.loader.template.TemplateLoader;
import com.synesis.loader.validation.UndefinedCode;
import com.synesis.loader.validation.ValidationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ItemFieldBinderTest extends SynesisLoggingConfig {
    private static final String TEMPLATE =
            String.join(
                    "\n",
                    "ITEM FIELDS",
                    "    OPTIONAL quote, code, themes, path",
                    "END ITEM FIELDS",
                    "FIELD quote TYPE QUOTATION SCOPE ITEM END FIELD",
                    "FIELD code TYPE CODE SCOPE ITEM END FIELD",
                    "FIELD themes TYPE CODE SCOPE ITEM END FIELD",
                    "FIELD path TYPE CHAIN SCOPE ITEM END FIELD",
                    "");

    private TemplateNode template;
    private ItemFieldBinder binder;

    @BeforeEach
    void setUp() throws Exception {
        template = new TemplateLoader().loadFromString(TEMPLATE, "custom.synt");
        binder = new ItemFieldBinder(template);
    }

    @Test
    void bindsCustomCodeFieldPerCode() throws Exception {
        ItemNode item =
                SynesisFixtures.item("ITEM @a", "    themes: Solar Energy, Wind,  Hydro", "END ITEM");
        assertInstanceOf(FieldValue.TextValue.class, item.getExtraField("themes").orElseThrow());

        binder.bind(item);

        FieldValue themes = item.getExtraField("themes").orElseThrow();
        assertEquals(3, themes.count());
        assertEquals("Solar Energy, Wind, Hydro", themes.asText());
        List<SourceLocation> locations = item.getExtraCodeLocations("themes");
        assertEquals(3, locations.size());
        assertEquals(13, locations.get(0).getColumn());
        assertEquals(27, locations.get(1).getColumn());
        assertEquals(34, locations.get(2).getColumn());
    }

    @Test
    void bindsCustomChainField() throws Exception {
        ItemNode item =
                SynesisFixtures.item(
                        "ITEM @a", "    path: Solar -> Cost", "    path: Cost -> Adoption", "END ITEM");

        binder.bind(item);

        FieldValue path = item.getExtraField("path").orElseThrow();
        assertEquals(2, path.count());
        FieldValue.ChainValue first = assertInstanceOf(FieldValue.ChainValue.class, path.elements().get(0));
        assertEquals(List.of("Solar", "Cost"), first.chain().getNodes());
    }

    @Test
    void bindingIsIdempotent() throws Exception {
        ItemNode item = SynesisFixtures.item("ITEM @a", "    themes: Solar, Wind", "END ITEM");

        binder.bind(item);
        FieldValue once = item.getExtraField("themes").orElseThrow();
        List<SourceLocation> onceLocations = item.getExtraCodeLocations("themes");
        binder.bind(item);

        assertEquals(once, item.getExtraField("themes").orElseThrow());
        assertEquals(onceLocations, item.getExtraCodeLocations("themes"));
    }

    @Test
    void boundFieldsLeavesItemUntouched() throws Exception {
        ItemNode item = SynesisFixtures.item("ITEM @a", "    themes: Solar, Wind", "END ITEM");

        Map<String, FieldValue> bound = binder.boundFields(item);

        assertEquals(2, bound.get("themes").count());
        assertEquals(1, item.getExtraField("themes").orElseThrow().count());
        assertTrue(item.getExtraCodeLocations("themes").isEmpty());
    }

    @Test
    void codeReferencesReadSlotOnceThenCustomFields() throws Exception {
        ItemNode item =
                SynesisFixtures.item("ITEM @a", "    code: Solar", "    themes: Wind, Hydro", "END ITEM");

        List<CodeReference> references = binder.codeReferences(item);

        assertEquals(3, references.size());
        assertEquals("Solar", references.get(0).code());
        assertEquals("code", references.get(0).fieldName());
        assertEquals("Wind", references.get(1).code());
        assertEquals("themes", references.get(1).fieldName());
        assertEquals(3, references.get(2).location().getLine());
    }

    @Test
    void slotCodesWithoutTemplate() throws Exception {
        ItemNode item = SynesisFixtures.item("ITEM @a", "    codes: A, B", "END ITEM");

        List<CodeReference> references = ItemFieldBinder.slotCodeReferences(item);

        assertEquals(List.of("A", "B"), List.of(references.get(0).code(), references.get(1).code()));
    }

    @Test
    void validatorReportsUndefinedCustomCodes() throws Exception {
        ItemNode item = SynesisFixtures.item("ITEM @a", "    themes: Solar, Wind", "END ITEM");
        SemanticValidator validator =
                new SemanticValidator(template, null, SemanticValidator.indexOntologies(SynesisFixtures.ontologies()));

        ValidationResult result = validator.validateItem(item);

        assertEquals(1, result.getAll().size(), result::toDiagnostics);
        UndefinedCode warning = (UndefinedCode) result.getWarnings().get(0);
        assertEquals("Wind", warning.getCode());
        assertEquals(20, warning.getLocation().getColumn());
    }
}
