package com.synesis.compiler;

import com.synesis.loader.SynesisAstBuilder;
import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.BlockNode;
import com.synesis.loader.ast.IncludeNode;
import com.synesis.loader.ast.IncludeNode.IncludeType;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.SynesisDocument;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.Bibliography;
import com.synesis.loader.semantic.SemanticValidator;
import com.synesis.loader.template.TemplateLoadException;
import com.synesis.loader.template.TemplateLoader;
import com.synesis.loader.validation.Diagnostic;
import com.synesis.loader.validation.InvalidProjectFile;
import com.synesis.loader.validation.InvalidSyntax;
import com.synesis.loader.validation.MissingProjectFile;
import com.synesis.loader.validation.MissingTemplateFile;
import com.synesis.loader.validation.ValidationResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.antlr.v4.runtime.CharStreams;

/**
 * Finds the schema a file belongs to, for editor integrations. The workspace root is the nearest ancestor directory
 * holding a {@code .synp} file, or failing that a {@code .git} or {@code .vscode} marker. The first {@code .synp} of
 * the root in name order is the project. Problems with the project or its template are reported as diagnostics.
 *
 * <p>Nothing is cached; every call reads the files again.
 */
public final class ProjectContextResolver {
    private static final Logger LOG = Logger.getLogger(ProjectContextResolver.class.getName());
    private static final String PROJECT_EXTENSION = ".synp";
    private static final int MAX_LEVELS = 10;

    public static final class Resolution {
        private final SchemaContext context;
        private final List<Diagnostic> diagnostics;

        Resolution(SchemaContext context, List<Diagnostic> diagnostics) {
            this.context = context;
            this.diagnostics = List.copyOf(diagnostics);
        }

        public Optional<SchemaContext> getContext() {
            return Optional.ofNullable(context);
        }

        public List<Diagnostic> getDiagnostics() {
            return diagnostics;
        }
    }

    private final BibliographyLoader bibliographyLoader;
    private final SynesisAstBuilder astBuilder = new SynesisAstBuilder();

    public ProjectContextResolver() {
        this(null);
    }

    public ProjectContextResolver(BibliographyLoader bibliographyLoader) {
        this.bibliographyLoader = bibliographyLoader;
    }

    public Resolution resolve(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path absolute = file.toAbsolutePath().normalize();
        Optional<Path> root = findWorkspaceRoot(absolute);
        if (root.isEmpty()) {
            return new Resolution(null, List.of());
        }
        List<Path> projectFiles = listProjectFiles(root.get());
        if (projectFiles.isEmpty()) {
            LOG.warning(() -> "No " + PROJECT_EXTENSION + " file in workspace " + root.get());
            return new Resolution(
                    null,
                    List.of(new MissingProjectFile(SourceLocation.startOf(file.toString()), root.get().toString())));
        }
        Path projectFile = projectFiles.get(0);
        if (projectFiles.size() > 1) {
            LOG.warning(() -> "Several project files in " + root.get() + ", using " + projectFile.getFileName());
        }

        ProjectNode project;
        try {
            project =
                    CompilationPipeline.requireProject(
                            astBuilder.parse(
                                    projectFile.toString(), CharStreams.fromPath(projectFile, StandardCharsets.UTF_8)));
        } catch (SynesisSyntaxException ex) {
            return new Resolution(
                    null,
                    List.of(
                            new InvalidProjectFile(
                                    SourceLocation.startOf(projectFile.toString()),
                                    projectFile.toString(),
                                    ex.getMessage())));
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        IncludeResolver includes = new IncludeResolver(projectFile.getParent());
        TemplateNode template = loadTemplate(project, projectFile, includes, diagnostics);
        Bibliography bibliography = loadBibliography(project, includes);
        return new Resolution(new SchemaContext(root.get(), projectFile, project, template, bibliography), diagnostics);
    }

    /**
     * Validates one file's contents against the schema of its workspace. Syntax errors are returned as diagnostics
     * and end the check; semantic checks run only when a template was found.
     */
    public ValidationResult validateFile(Path path, String content) throws IOException {
        ValidationResult result = new ValidationResult();
        Resolution resolution = resolve(path);
        result.addAll(resolution.getDiagnostics());

        SynesisDocument document;
        try {
            document = astBuilder.parse(path.toString(), content);
        } catch (SynesisSyntaxException ex) {
            result.add(new InvalidSyntax(ex.getLocation(), ex.getMessage(), ex.getExpectedTokens()));
            return result;
        }

        Optional<SchemaContext> context = resolution.getContext();
        if (context.isEmpty() || context.get().getTemplate().isEmpty()) {
            return result;
        }
        List<OntologyNode> ontologies = document.getOntologies();
        SemanticValidator validator =
                new SemanticValidator(
                        context.get().getTemplate().get(),
                        context.get().getBibliography().orElse(null),
                        SemanticValidator.indexOntologies(ontologies));
        for (BlockNode block : document.getBlocks()) {
            if (block instanceof SourceNode) {
                result.addAll(validator.validateSource((SourceNode) block).getAll());
            } else if (block instanceof ItemNode) {
                result.addAll(validator.validateItem((ItemNode) block).getAll());
            } else if (block instanceof OntologyNode) {
                result.addAll(validator.validateOntology((OntologyNode) block).getAll());
            }
        }
        return result;
    }

    static Optional<Path> findWorkspaceRoot(Path file) throws IOException {
        Path current = Files.isDirectory(file) ? file : file.getParent();
        for (int level = 0; current != null && level < MAX_LEVELS; level++) {
            if (!listProjectFiles(current).isEmpty()
                    || Files.exists(current.resolve(".git"))
                    || Files.exists(current.resolve(".vscode"))) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    private static List<Path> listProjectFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(directory)) {
            List<Path> files =
                    stream.filter(Files::isRegularFile)
                            .filter(path -> path.getFileName().toString().endsWith(PROJECT_EXTENSION))
                            .collect(Collectors.toList());
            Collections.sort(files);
            return files;
        }
    }

    private TemplateNode loadTemplate(
            ProjectNode project, Path projectFile, IncludeResolver includes, List<Diagnostic> diagnostics)
            throws IOException {
        Optional<String> declared = IncludeResolver.templatePath(project);
        Path templatePath = includes.toPath(declared.orElse(""));
        if (declared.isEmpty() || !Files.isRegularFile(templatePath)) {
            diagnostics.add(
                    new MissingTemplateFile(project.getLocation(), templatePath.toString(), projectFile.toString()));
            return null;
        }
        try {
            return new TemplateLoader(astBuilder).load(templatePath);
        } catch (SynesisSyntaxException | TemplateLoadException ex) {
            LOG.warning(() -> "Template " + templatePath + " failed to load: " + ex.getMessage());
            diagnostics.add(new InvalidProjectFile(project.getLocation(), templatePath.toString(), ex.getMessage()));
            return null;
        }
    }

    private Bibliography loadBibliography(ProjectNode project, IncludeResolver includes) throws IOException {
        List<IncludeNode> bibliographies = project.getIncludes(IncludeType.BIBLIOGRAPHY);
        if (bibliographyLoader == null || bibliographies.isEmpty()) {
            return null;
        }
        Path path = includes.toPath(bibliographies.get(0).getPath());
        if (!Files.isRegularFile(path)) {
            LOG.warning(() -> "Bibliography not found: " + path);
            return null;
        }
        return bibliographyLoader.load(path);
    }
}
