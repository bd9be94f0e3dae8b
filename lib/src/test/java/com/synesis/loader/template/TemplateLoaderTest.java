package com.synesis.loader.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synesis.loader.SynesisFixtures;
import com.synesis.loader.SynesisLoggingConfig;
import com.synesis.loader.ast.FieldSlot;
import com.synesis.loader.ast.FieldSpec;
import com.synesis.loader.ast.FieldType;
import com.synesis.loader.ast.OrderedValue;
import com.synesis.loader.ast.Scope;
import com.synesis.loader.ast.TemplateNode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateLoaderTest extends SynesisLoggingConfig {
    private final TemplateLoader loader = new TemplateLoader();

    @Test
    void loadsHeaderAndRequirements() throws Exception {
        TemplateNode template = loader.loadFromString(SynesisFixtures.TEMPLATE, "energia.synt");

        assertEquals("energia", template.getName());
        assertEquals(Map.of("version", "1.0"), template.getMetadata());
        assertEquals(List.of("title"), template.getRequiredFields(Scope.SOURCE));
        assertEquals(List.of("year"), template.getOptionalFields(Scope.SOURCE));
        assertEquals(List.of("quote"), template.getRequiredFields(Scope.ITEM));
        assertEquals(List.of(List.of("note", "chain")), template.getBundledFields(Scope.ITEM));
        assertEquals(List.of("secret"), template.getForbiddenFields(Scope.ITEM));
        assertTrue(template.getBundledFields(Scope.SOURCE).isEmpty());
    }

    @Test
    void loadsFieldDefinitions() throws Exception {
        TemplateNode template = loader.loadFromString(SynesisFixtures.TEMPLATE, "energia.synt");

        FieldSpec chain = template.getFieldSpec("chain").orElseThrow();
        assertEquals(FieldType.CHAIN, chain.getType());
        assertEquals(Scope.ITEM, chain.getScope());
        assertTrue(chain.isQualifiedChain());
        assertEquals(List.of("INFLUENCES", "ENABLES"), List.copyOf(chain.getRelations().keySet()));
        assertEquals("= 3", chain.getArity().orElseThrow());
        assertEquals("Cadeia causal entre codigos", chain.getDescription().orElseThrow());

        FieldSpec confidence = template.getFieldSpec("confidence").orElseThrow();
        List<OrderedValue> values = confidence.getValues();
        assertEquals(3, values.size());
        assertEquals(3, values.get(2).getIndex());
        assertEquals("High", values.get(2).getLabel());
        assertEquals("alta", values.get(2).getDescription());

        assertEquals("[0..10]", template.getFieldSpec("weight").orElseThrow().getFormat().orElseThrow());
        assertFalse(template.getFieldSpec("category").orElseThrow().isQualifiedChain());
    }

    @Test
    void exposesSchemaQueries() throws Exception {
        TemplateNode template = loader.loadFromString(SynesisFixtures.TEMPLATE, "energia.synt");

        assertEquals(List.of("title", "year"), template.getFieldNamesForScope(Scope.SOURCE));
        assertEquals(
                List.of("code", "chain"),
                template.getFieldNamesForScopeAndTypes(Scope.ITEM, List.of(FieldType.CODE, FieldType.CHAIN)));
        assertEquals("quote", template.getSlotSpec(FieldSlot.QUOTE).orElseThrow().getName());
        assertEquals("code", template.getSlotSpec(FieldSlot.CODES).orElseThrow().getName());
        assertTrue(template.getSlotSpec(FieldSlot.PARENTS).isEmpty());
    }

    @Test
    void fileWithoutHeaderYieldsUnnamedTemplate() throws Exception {
        String content = String.join("\n", "FIELD title TYPE TEXT SCOPE SOURCE END FIELD", "");

        TemplateNode template = loader.loadFromString(content, "bare.synt");

        assertEquals("", template.getName());
        assertTrue(template.getMetadata().isEmpty());
        assertTrue(template.isDefined("title"));
    }

    @Test
    void rejectsDuplicateField() {
        String content =
                String.join(
                        "\n",
                        "FIELD title TYPE TEXT SCOPE SOURCE END FIELD",
                        "FIELD title TYPE MEMO SCOPE SOURCE END FIELD",
                        "");

        TemplateLoadException error =
                assertThrows(TemplateLoadException.class, () -> loader.loadFromString(content, "dup.synt"));

        assertEquals(2, error.getLocation().getLine());
        assertTrue(error.getDetail().contains("duplicado"), error.getDetail());
        assertTrue(error.getDetail().contains("title"), error.getDetail());
    }

    @Test
    void rejectsOrderedValueWithoutIndex() {
        String content =
                String.join(
                        "\n",
                        "FIELD confidence TYPE ORDERED SCOPE ITEM",
                        "    VALUES",
                        "        [1] Low: baixa",
                        "        High: alta",
                        "    END VALUES",
                        "END FIELD",
                        "");

        TemplateLoadException error =
                assertThrows(TemplateLoadException.class, () -> loader.loadFromString(content, "ordered.synt"));

        assertEquals(4, error.getLocation().getLine());
        assertTrue(error.getDetail().contains("confidence"), error.getDetail());
    }

    @Test
    void rejectsNegativeOrderedIndex() {
        String content =
                String.join(
                        "\n",
                        "FIELD confidence TYPE ORDERED SCOPE ITEM",
                        "    VALUES",
                        "        [-1] Low: baixa",
                        "    END VALUES",
                        "END FIELD",
                        "");

        assertThrows(TemplateLoadException.class, () -> loader.loadFromString(content, "negative.synt"));
    }

    @Test
    void rejectsUndefinedListedName() {
        String content =
                String.join(
                        "\n",
                        "ITEM FIELDS",
                        "    REQUIRED quote",
                        "    OPTIONAL missing",
                        "END ITEM FIELDS",
                        "FIELD quote TYPE QUOTATION SCOPE ITEM END FIELD",
                        "");

        TemplateLoadException error =
                assertThrows(TemplateLoadException.class, () -> loader.loadFromString(content, "undef.synt"));

        assertEquals(3, error.getLocation().getLine());
        assertTrue(error.getDetail().contains("'missing'"), error.getDetail());
        assertTrue(error.getDetail().contains("ITEM FIELDS"), error.getDetail());
    }

    @Test
    void rejectsUndefinedBundleMember() {
        String content =
                String.join(
                        "\n",
                        "ITEM FIELDS",
                        "    REQUIRED BUNDLE note, chain",
                        "END ITEM FIELDS",
                        "FIELD note TYPE MEMO SCOPE ITEM END FIELD",
                        "");

        TemplateLoadException error =
                assertThrows(TemplateLoadException.class, () -> loader.loadFromString(content, "bundle.synt"));

        assertTrue(error.getDetail().contains("'chain'"), error.getDetail());
    }

    @Test
    void loadsFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("energia.synt");
        Files.writeString(file, SynesisFixtures.TEMPLATE, StandardCharsets.UTF_8);

        TemplateNode template = loader.load(file);

        assertEquals("energia", template.getName());
        assertEquals(file.toString(), template.getLocation().getSourceName());
    }
}
