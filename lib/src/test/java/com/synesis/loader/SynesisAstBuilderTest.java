package com.synesis.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synesis.loader.ast.ChainNode;
import com.synesis.loader.ast.FieldValue;
import com.synesis.loader.ast.IncludeNode;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.SynesisDocument;
import java.util.List;
import org.junit.jupiter.api.Test;

class SynesisAstBuilderTest extends SynesisLoggingConfig {
    private final SynesisAstBuilder builder = new SynesisAstBuilder();

    @Test
    void parsesSourceWithFields() throws Exception {
        String input =
                String.join(
                        "\n",
                        "SOURCE @silva2023",
                        "    title: \"Energia no Brasil\"",
                        "    year: 2023",
                        "END SOURCE",
                        "");

        SynesisDocument document = builder.parse("sample.syn", input);

        assertEquals(1, document.getSources().size());
        SourceNode source = document.getSources().get(0);
        assertEquals("@silva2023", source.getBibref());
        assertEquals("Energia no Brasil", source.getFields().get("title").asText());
        FieldValue year = source.getFields().get("year");
        assertInstanceOf(FieldValue.NumberValue.class, year);
        assertEquals("2023", year.asText());
        assertEquals(new SourceLocation("sample.syn", 1, 1), source.getLocation());
    }

    @Test
    void parsesItemSlots() throws Exception {
        String input =
                String.join(
                        "\n",
                        "ITEM @silva2023",
                        "    quote: \"Custos de instalacao ainda sao altos\"",
                        "    code: Solar Energy, Wind Power",
                        "    note: primeira nota",
                        "    note: segunda nota",
                        "    chain: Cost -> Adoption",
                        "END ITEM",
                        "");

        ItemNode item = builder.parse("items.syn", input).getItems().get(0);

        assertEquals("Custos de instalacao ainda sao altos", item.getQuote());
        assertEquals(List.of("Solar Energy", "Wind Power"), item.getCodes());
        List<SourceLocation> codeLocations = item.getCodeLocations();
        assertEquals(2, codeLocations.size());
        assertEquals(3, codeLocations.get(0).getLine());
        assertEquals(3, codeLocations.get(1).getLine());
        assertTrue(codeLocations.get(1).getColumn() > codeLocations.get(0).getColumn());
        assertEquals(List.of("primeira nota", "segunda nota"), item.getNotes());
        assertEquals(1, item.getChains().size());
        assertEquals(List.of("Cost", "Adoption"), item.getChains().get(0).getNodes());
    }

    @Test
    void itemWithoutQuoteHasEmptyQuote() throws Exception {
        String input = String.join("\n", "ITEM @a", "    code: X", "END ITEM", "");

        ItemNode item = builder.parse("noquote.syn", input).getItems().get(0);

        assertEquals("", item.getQuote());
    }

    @Test
    void keywordsAreCaseInsensitive() throws Exception {
        String input = String.join("\n", "source @lower2020", "    title: t", "end source", "");

        SynesisDocument document = builder.parse("lower.syn", input);

        assertEquals(1, document.getSources().size());
        assertEquals("@lower2020", document.getSources().get(0).getBibref());
    }

    @Test
    void ignoresBlankLinesAndComments() throws Exception {
        String input =
                String.join(
                        "\n",
                        "# fontes do projeto",
                        "",
                        "SOURCE @a",
                        "",
                        "    title: t",
                        "",
                        "END SOURCE",
                        "",
                        "",
                        "SOURCE @b",
                        "    title: u",
                        "END SOURCE",
                        "");

        SynesisDocument document = builder.parse("blank.syn", input);

        assertEquals(2, document.getSources().size());
    }

    @Test
    void keepsScientificSymbolsInText() throws Exception {
        String input =
                String.join("\n", "ITEM @a", "    quote: CO₂ aumentou 2,5% (p < 0.05) em 10 m²", "END ITEM", "");

        ItemNode item = builder.parse("symbols.syn", input).getItems().get(0);

        assertEquals("CO₂ aumentou 2,5% (p < 0.05) em 10 m²", item.getQuote());
    }

    @Test
    void joinsContinuationLines() throws Exception {
        String input =
                String.join(
                        "\n",
                        "ITEM @a",
                        "    quote:",
                        "        primeira linha",
                        "        segunda linha",
                        "END ITEM",
                        "");

        ItemNode item = builder.parse("multi.syn", input).getItems().get(0);

        assertEquals("primeira linha\nsegunda linha", item.getQuote());
    }

    @Test
    void parsesOntologyWithParentChain() throws Exception {
        String input =
                String.join(
                        "\n",
                        "ONTOLOGY Solar",
                        "    description: Energia do sol",
                        "    topic: Renewables",
                        "    parent: Energy",
                        "END ONTOLOGY",
                        "");

        OntologyNode ontology = builder.parse("concepts.syno", input).getOntologies().get(0);

        assertEquals("Solar", ontology.getConcept());
        assertEquals("Energia do sol", ontology.getDescription());
        assertEquals("Renewables", ontology.getFields().get("topic").asText());
        assertEquals(1, ontology.getParentChains().size());
        ChainNode parent = ontology.getParentChains().get(0);
        assertEquals(List.of("Solar", "Energy"), parent.getNodes());
    }

    @Test
    void parsesProjectIncludes() throws Exception {
        String input =
                String.join(
                        "\n",
                        "PROJECT Energia",
                        "    TEMPLATE \"schema.synt\"",
                        "    INCLUDE BIBLIOGRAPHY \"refs.bib\"",
                        "    INCLUDE ANNOTATIONS \"data/*.syn\"",
                        "    INCLUDE ONTOLOGY \"concepts.syno\"",
                        "END PROJECT",
                        "");

        ProjectNode project = builder.parse("energia.synp", input).getProjects().get(0);

        assertEquals("Energia", project.getName());
        assertEquals("schema.synt", project.getTemplatePath());
        assertEquals(3, project.getIncludes().size());
        List<IncludeNode> annotations = project.getIncludes(IncludeNode.IncludeType.ANNOTATIONS);
        assertEquals(1, annotations.size());
        assertEquals("data/*.syn", annotations.get(0).getPath());
        assertTrue(annotations.get(0).isGlob());
    }

    @Test
    void unclosedBlockNamesFileAndBlock() {
        String input = String.join("\n", "SOURCE @a", "    title: t", "");

        SynesisSyntaxException error =
                assertThrows(SynesisSyntaxException.class, () -> builder.parse("open.syn", input));

        assertTrue(error.getMessage().contains("erro:"), error.getMessage());
        assertTrue(error.getMessage().contains("open.syn"), error.getMessage());
        assertTrue(error.getMessage().contains("END SOURCE"), error.getMessage());
    }

    @Test
    void unindentedFieldIsRejected() {
        String input = String.join("\n", "ITEM @a", "quote: texto", "END ITEM", "");

        SynesisSyntaxException error =
                assertThrows(SynesisSyntaxException.class, () -> builder.parse("flat.syn", input));

        assertTrue(error.getMessage().contains("erro:"), error.getMessage());
        assertTrue(error.getMessage().contains("flat.syn"), error.getMessage());
        assertTrue(error.getMessage().contains("indentado"), error.getMessage());
        assertEquals(2, error.getLocation().getLine());
    }

    @Test
    void emptyFieldValueIsRejected() {
        String input = String.join("\n", "SOURCE @a", "    title:", "END SOURCE", "");

        SynesisSyntaxException error =
                assertThrows(SynesisSyntaxException.class, () -> builder.parse("empty.syn", input));

        assertTrue(error.getMessage().contains("title"), error.getMessage());
    }

    @Test
    void normalizesUppercaseFieldNames() {
        assertEquals("quote", SynesisAstBuilder.normalizeFieldName("QUOTE"));
        assertEquals("note_1", SynesisAstBuilder.normalizeFieldName("NOTE_1"));
        assertEquals("myField", SynesisAstBuilder.normalizeFieldName("myField"));
    }

    @Test
    void dedentKeepsRelativeIndentation() {
        List<String> lines = List.of("        a", "            b", "   ", "        c");

        assertEquals(List.of("a", "    b", "", "c"), SynesisAstBuilder.dedent(lines));
    }

    @Test
    void unquoteResolvesEscapes() {
        assertEquals("a \"b\"\n", SynesisAstBuilder.unquote("\"a \\\"b\\\"\\n\""));
        assertEquals("plain", SynesisAstBuilder.unquote("plain"));
    }
}
