package com.synesis.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.BlockNode;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.Triple;
import com.synesis.loader.semantic.BibEntry;
import com.synesis.loader.semantic.LinkedProject;
import com.synesis.loader.semantic.MapBibliography;
import com.synesis.loader.validation.OrphanItem;
import com.synesis.loader.validation.UnregisteredSource;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryCompilerTest extends CompilerLoggingConfig {

    @Test
    void compilesCleanProject() throws Exception {
        CompilationResult result = energia().build().compile();

        assertTrue(result.isSuccess(), result::getDiagnostics);
        assertFalse(result.hasWarnings(), result::getDiagnostics);
        CompilationStats stats = result.getStats();
        assertEquals(1, stats.getSourceCount());
        assertEquals(1, stats.getItemCount());
        assertEquals(2, stats.getOntologyCount());
        assertEquals(2, stats.getCodeCount());
        assertEquals(1, stats.getChainCount());
        assertEquals(1, stats.getTripleCount());

        LinkedProject linked = result.getLinkedProject();
        assertEquals("Energia", linked.getProject().getName());
        ItemNode item = linked.getSources().get("silva2023").getItems().get(0);
        assertEquals("hello", item.getQuote());
        assertEquals(List.of(new Triple("Solar", "INFLUENCES", "Cost")), linked.getAllTriples());
        assertEquals("energia", result.getTemplate().getName());
        assertTrue(result.getBibliography().isEmpty());
    }

    @Test
    void minimalProjectWithEmptySource() throws Exception {
        CompilationResult result =
                InMemoryCompiler.builder()
                        .project("PROJECT minimo\nEND PROJECT\n")
                        .template(
                                CompilerFixtures.lines(
                                        "ITEM FIELDS",
                                        "    REQUIRED quote",
                                        "END ITEM FIELDS",
                                        "FIELD quote TYPE QUOTATION SCOPE ITEM END FIELD"))
                        .annotation(
                                "a.syn",
                                CompilerFixtures.lines(
                                        "SOURCE @silva2023",
                                        "END SOURCE",
                                        "ITEM @silva2023",
                                        "    quote: \"hello\"",
                                        "END ITEM"))
                        .build()
                        .compile();

        assertEquals(0, result.getValidationResult().getErrors().size(), result::getDiagnostics);
        assertEquals(1, result.getStats().getSourceCount());
        assertEquals(1, result.getStats().getItemCount());
        List<ItemNode> items = result.getLinkedProject().getSources().get("silva2023").getItems();
        assertEquals(1, items.size());
        assertEquals("hello", items.get(0).getQuote());
    }

    @Test
    void checksReferencesAgainstBibliography() throws Exception {
        CompilationResult registered =
                energia()
                        .bibliography(MapBibliography.of(new BibEntry("silva2023", Map.of("title", "Energia"))))
                        .build()
                        .compile();
        assertTrue(registered.isSuccess(), registered::getDiagnostics);

        CompilationResult unregistered =
                energia()
                        .bibliography(MapBibliography.of(new BibEntry("silva2022", Map.of())))
                        .build()
                        .compile();
        assertFalse(unregistered.isSuccess());
        UnregisteredSource error =
                assertInstanceOf(UnregisteredSource.class, unregistered.getValidationResult().getErrors().get(0));
        assertEquals(List.of("silva2022"), error.getSuggestions());
        assertEquals(1, unregistered.getLinkedProject().getSources().size());
    }

    @Test
    void orphanItemIsReportedButProjectStillLinks() throws Exception {
        CompilationResult result =
                energia()
                        .annotation(
                                "orphans.syn",
                                CompilerFixtures.lines("ITEM @ghost2000", "    quote: perdido", "END ITEM"))
                        .build()
                        .compile();

        assertTrue(result.hasErrors());
        assertInstanceOf(OrphanItem.class, result.getValidationResult().getErrors().get(0));
        assertEquals(2, result.getStats().getItemCount());
        assertEquals(1, result.getLinkedProject().getItems().size());
        assertTrue(result.getDiagnostics().startsWith("=== ERROS ==="), result.getDiagnostics());
    }

    @Test
    void syntaxErrorAbortsCompilation() {
        InMemoryCompiler compiler =
                energia().annotation("broken.syn", CompilerFixtures.lines("ITEM @a", "quote: x", "END ITEM")).build();

        SynesisSyntaxException error = assertThrows(SynesisSyntaxException.class, compiler::compile);
        assertEquals("broken.syn", error.getLocation().getSourceName());
        assertEquals(2, error.getLocation().getLine());
    }

    @Test
    void projectContentMustHoldProjectBlock() {
        InMemoryCompiler compiler = energia().project(CompilerFixtures.SOURCE, "wrong.synp").build();

        SynesisSyntaxException error = assertThrows(SynesisSyntaxException.class, compiler::compile);
        assertTrue(error.getMessage().contains("Nenhum bloco PROJECT"), error.getMessage());
    }

    @Test
    void builderRequiresProjectAndTemplate() {
        assertThrows(NullPointerException.class, () -> InMemoryCompiler.builder().template("").build());
        assertThrows(
                NullPointerException.class,
                () -> InMemoryCompiler.builder().project("PROJECT p\nEND PROJECT\n").build());
    }

    @Test
    void compileStringReturnsBlocksInOrder() throws Exception {
        List<BlockNode> blocks = InMemoryCompiler.compileString(CompilerFixtures.SOURCE + CompilerFixtures.ITEM);

        assertEquals(2, blocks.size());
        SourceNode source = assertInstanceOf(SourceNode.class, blocks.get(0));
        assertEquals("<string>", source.getLocation().getSourceName());
        assertInstanceOf(ItemNode.class, blocks.get(1));
        assertEquals("x.syn", InMemoryCompiler.compileString(CompilerFixtures.SOURCE, "x.syn").get(0).getLocation()
                .getSourceName());
    }

    private static InMemoryCompiler.Builder energia() {
        return InMemoryCompiler.builder()
                .project("PROJECT Energia\nEND PROJECT\n", "energia.synp")
                .template(CompilerFixtures.TEMPLATE, "energia.synt")
                .ontology("concepts.syno", CompilerFixtures.ONTOLOGY)
                .annotation("sources.syn", CompilerFixtures.SOURCE)
                .annotation("items.syn", CompilerFixtures.ITEM);
    }
}
