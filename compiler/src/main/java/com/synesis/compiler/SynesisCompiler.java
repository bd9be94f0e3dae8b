package com.synesis.compiler;

import com.synesis.loader.SynesisAstBuilder;
import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.IncludeNode;
import com.synesis.loader.ast.IncludeNode.IncludeType;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.SynesisDocument;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.Bibliography;
import com.synesis.loader.template.TemplateLoadException;
import com.synesis.loader.template.TemplateLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStreams;

/**
 * Compiles a project file and everything it includes. The template path and every INCLUDE are resolved relative to
 * the directory of the project file; ANNOTATIONS and ONTOLOGY includes may be glob patterns.
 *
 * <p>A syntax error in any file, or an inconsistent template, aborts the run with an exception. Semantic problems do
 * not: they are collected in the returned {@link CompilationResult}.
 */
public final class SynesisCompiler {
    private static final Logger LOG = Logger.getLogger(SynesisCompiler.class.getName());

    private final Path projectFile;
    private final Path projectDir;
    private final BibliographyLoader bibliographyLoader;
    private final SynesisAstBuilder astBuilder = new SynesisAstBuilder();

    public SynesisCompiler(Path projectFile) {
        this(projectFile, null);
    }

    /**
     * @param bibliographyLoader reads the included bibliography, or {@code null} to skip reference checks
     */
    public SynesisCompiler(Path projectFile, BibliographyLoader bibliographyLoader) {
        this.projectFile = Objects.requireNonNull(projectFile, "projectFile");
        Path parent = projectFile.toAbsolutePath().getParent();
        this.projectDir = parent != null ? parent : Path.of("").toAbsolutePath();
        this.bibliographyLoader = bibliographyLoader;
    }

    public CompilationResult compile() throws IOException, SynesisSyntaxException, TemplateLoadException {
        ProjectNode project = parseProject();
        IncludeResolver includes = new IncludeResolver(projectDir);
        TemplateNode template = loadTemplate(project, includes);
        Bibliography bibliography = loadBibliography(project, includes);

        CompilationPipeline pipeline = new CompilationPipeline(project, template, bibliography);
        for (Path path : includes.resolve(project, IncludeType.ONTOLOGY)) {
            pipeline.addOntologies(parse(path));
        }
        for (Path path : includes.resolve(project, IncludeType.ANNOTATIONS)) {
            pipeline.addAnnotations(parse(path));
        }
        return pipeline.run();
    }

    ProjectNode parseProject() throws IOException, SynesisSyntaxException {
        return CompilationPipeline.requireProject(parse(projectFile));
    }

    private TemplateNode loadTemplate(ProjectNode project, IncludeResolver includes)
            throws IOException, SynesisSyntaxException, TemplateLoadException {
        Optional<String> templatePath = IncludeResolver.templatePath(project);
        if (templatePath.isEmpty()) {
            throw new TemplateLoadException(project.getLocation(), "PROJECT nao declara TEMPLATE");
        }
        Path path = includes.toPath(templatePath.get());
        LOG.fine(() -> "Loading template " + path);
        return new TemplateLoader(astBuilder).load(path);
    }

    private Bibliography loadBibliography(ProjectNode project, IncludeResolver includes) throws IOException {
        List<IncludeNode> bibliographies = project.getIncludes(IncludeType.BIBLIOGRAPHY);
        if (bibliographyLoader == null || bibliographies.isEmpty()) {
            return null;
        }
        Path path = includes.toPath(bibliographies.get(0).getPath());
        LOG.fine(() -> "Loading bibliography " + path);
        return bibliographyLoader.load(path);
    }

    private SynesisDocument parse(Path path) throws IOException, SynesisSyntaxException {
        return astBuilder.parse(path.toString(), CharStreams.fromPath(path, StandardCharsets.UTF_8));
    }
}
