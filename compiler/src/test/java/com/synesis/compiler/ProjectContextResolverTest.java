package com.synesis.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synesis.loader.semantic.MapBibliography;
import com.synesis.loader.validation.InvalidProjectFile;
import com.synesis.loader.validation.InvalidSyntax;
import com.synesis.loader.validation.MissingProjectFile;
import com.synesis.loader.validation.MissingRequiredField;
import com.synesis.loader.validation.MissingTemplateFile;
import com.synesis.loader.validation.UnregisteredSource;
import com.synesis.loader.validation.ValidationResult;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectContextResolverTest extends CompilerLoggingConfig {
    @TempDir Path dir;

    @Test
    void findsProjectAboveNestedFile() throws Exception {
        Path projectFile = CompilerFixtures.writeProject(dir);

        ProjectContextResolver.Resolution resolution =
                new ProjectContextResolver().resolve(dir.resolve("data/b-items.syn"));

        assertTrue(resolution.getDiagnostics().isEmpty(), resolution.getDiagnostics()::toString);
        SchemaContext context = resolution.getContext().orElseThrow();
        assertEquals(dir.toAbsolutePath().normalize(), context.getWorkspaceRoot());
        assertEquals(projectFile.toAbsolutePath().normalize(), context.getProjectFile());
        assertEquals("Energia", context.getProject().getName());
        assertEquals("energia", context.getTemplate().orElseThrow().getName());
        assertTrue(context.getBibliography().isEmpty());
    }

    @Test
    void firstProjectFileInNameOrderWins() throws Exception {
        CompilerFixtures.writeProject(dir);
        CompilerFixtures.write(
                dir.resolve("aaa.synp"),
                CompilerFixtures.lines("PROJECT Primeiro", "    TEMPLATE \"schema.synt\"", "END PROJECT"));

        SchemaContext context = new ProjectContextResolver().resolve(dir.resolve("x.syn")).getContext().orElseThrow();

        assertEquals("Primeiro", context.getProject().getName());
    }

    @Test
    void workspaceMarkerWithoutProjectFile() throws Exception {
        Files.createDirectories(dir.resolve(".vscode"));

        ProjectContextResolver.Resolution resolution = new ProjectContextResolver().resolve(dir.resolve("notes.syn"));

        assertTrue(resolution.getContext().isEmpty());
        MissingProjectFile missing = assertInstanceOf(MissingProjectFile.class, resolution.getDiagnostics().get(0));
        assertEquals(dir.toAbsolutePath().normalize().toString(), missing.getWorkspaceRoot());
    }

    @Test
    void includeTemplateIsLoaded() throws Exception {
        CompilerFixtures.write(dir.resolve("schema.synt"), CompilerFixtures.TEMPLATE);
        CompilerFixtures.write(
                dir.resolve("p.synp"),
                CompilerFixtures.lines("PROJECT P", "    INCLUDE TEMPLATE \"schema.synt\"", "END PROJECT"));

        ProjectContextResolver.Resolution resolution = new ProjectContextResolver().resolve(dir.resolve("a.syn"));

        assertTrue(resolution.getDiagnostics().isEmpty(), resolution.getDiagnostics()::toString);
        assertEquals("energia", resolution.getContext().orElseThrow().getTemplate().orElseThrow().getName());
    }

    @Test
    void missingTemplateKeepsContext() throws Exception {
        CompilerFixtures.write(
                dir.resolve("p.synp"), CompilerFixtures.lines("PROJECT P", "    TEMPLATE \"absent.synt\"", "END PROJECT"));

        ProjectContextResolver.Resolution resolution = new ProjectContextResolver().resolve(dir.resolve("a.syn"));

        assertTrue(resolution.getContext().orElseThrow().getTemplate().isEmpty());
        MissingTemplateFile missing = assertInstanceOf(MissingTemplateFile.class, resolution.getDiagnostics().get(0));
        assertTrue(missing.getTemplatePath().endsWith("absent.synt"), missing.getTemplatePath());
    }

    @Test
    void brokenProjectFileIsDiagnostic() throws Exception {
        CompilerFixtures.write(dir.resolve("p.synp"), CompilerFixtures.lines("PROJECT P", "    TEMPLATE \"s.synt\""));

        ProjectContextResolver.Resolution resolution = new ProjectContextResolver().resolve(dir.resolve("a.syn"));

        assertTrue(resolution.getContext().isEmpty());
        assertInstanceOf(InvalidProjectFile.class, resolution.getDiagnostics().get(0));
    }

    @Test
    void validateFileRunsSemanticChecks() throws Exception {
        CompilerFixtures.writeProject(dir);
        Path file = dir.resolve("data/new.syn");

        ValidationResult result =
                new ProjectContextResolver()
                        .validateFile(file, CompilerFixtures.lines("ITEM @silva2023", "    code: Solar", "END ITEM"));

        assertEquals(1, result.getErrors().size(), result::toDiagnostics);
        MissingRequiredField missing = assertInstanceOf(MissingRequiredField.class, result.getErrors().get(0));
        assertEquals("quote", missing.getFieldName());
    }

    @Test
    void validateFileUsesLoadedBibliography() throws Exception {
        CompilerFixtures.writeProject(dir);

        ValidationResult result =
                new ProjectContextResolver(path -> MapBibliography.empty())
                        .validateFile(dir.resolve("data/a-sources.syn"), CompilerFixtures.SOURCE);

        assertInstanceOf(UnregisteredSource.class, result.getErrors().get(0));
    }

    @Test
    void validateFileReportsSyntaxErrors() throws Exception {
        CompilerFixtures.writeProject(dir);

        ValidationResult result =
                new ProjectContextResolver()
                        .validateFile(dir.resolve("bad.syn"), CompilerFixtures.lines("ITEM @a", "quote: x", "END ITEM"));

        assertEquals(1, result.getAll().size(), result::toDiagnostics);
        InvalidSyntax syntax = assertInstanceOf(InvalidSyntax.class, result.getErrors().get(0));
        assertEquals(2, syntax.getLocation().getLine());
    }
}
