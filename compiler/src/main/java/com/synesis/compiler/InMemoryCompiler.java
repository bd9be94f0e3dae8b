package com.synesis.compiler;

import com.synesis.loader.SynesisAstBuilder;
import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.BlockNode;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.Bibliography;
import com.synesis.loader.template.TemplateLoadException;
import com.synesis.loader.template.TemplateLoader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the compilation pipeline on file contents held in memory, for notebooks, editors and tests. Annotation and
 * ontology contents are compiled in the order they were added. Nothing touches the file system; INCLUDE and TEMPLATE
 * paths of the project are not followed.
 */
public final class InMemoryCompiler {
    private static final String DEFAULT_PROJECT_NAME = "<project>";
    private static final String DEFAULT_TEMPLATE_NAME = "<template>";
    private static final String DEFAULT_STRING_NAME = "<string>";

    private final String projectContent;
    private final String projectFilename;
    private final String templateContent;
    private final String templateFilename;
    private final Map<String, String> annotationContents;
    private final Map<String, String> ontologyContents;
    private final Bibliography bibliography;

    private InMemoryCompiler(Builder builder) {
        this.projectContent = Objects.requireNonNull(builder.projectContent, "projectContent");
        this.projectFilename = builder.projectFilename;
        this.templateContent = Objects.requireNonNull(builder.templateContent, "templateContent");
        this.templateFilename = builder.templateFilename;
        this.annotationContents = new LinkedHashMap<>(builder.annotationContents);
        this.ontologyContents = new LinkedHashMap<>(builder.ontologyContents);
        this.bibliography = builder.bibliography;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompilationResult compile() throws SynesisSyntaxException, TemplateLoadException {
        SynesisAstBuilder astBuilder = new SynesisAstBuilder();
        ProjectNode project = CompilationPipeline.requireProject(astBuilder.parse(projectFilename, projectContent));
        TemplateNode template = new TemplateLoader(astBuilder).loadFromString(templateContent, templateFilename);
        CompilationPipeline pipeline = new CompilationPipeline(project, template, bibliography);
        for (Map.Entry<String, String> ontology : ontologyContents.entrySet()) {
            pipeline.addOntologies(astBuilder.parse(ontology.getKey(), ontology.getValue()));
        }
        for (Map.Entry<String, String> annotation : annotationContents.entrySet()) {
            pipeline.addAnnotations(astBuilder.parse(annotation.getKey(), annotation.getValue()));
        }
        return pipeline.run();
    }

    public static List<BlockNode> compileString(String content, String filename) throws SynesisSyntaxException {
        return new SynesisAstBuilder().parse(filename, content).getBlocks();
    }

    public static List<BlockNode> compileString(String content) throws SynesisSyntaxException {
        return compileString(content, DEFAULT_STRING_NAME);
    }

    public static final class Builder {
        private String projectContent;
        private String projectFilename = DEFAULT_PROJECT_NAME;
        private String templateContent;
        private String templateFilename = DEFAULT_TEMPLATE_NAME;
        private final Map<String, String> annotationContents = new LinkedHashMap<>();
        private final Map<String, String> ontologyContents = new LinkedHashMap<>();
        private Bibliography bibliography;

        private Builder() {}

        public Builder project(String content) {
            this.projectContent = content;
            return this;
        }

        public Builder project(String content, String filename) {
            this.projectContent = content;
            this.projectFilename = Objects.requireNonNull(filename, "filename");
            return this;
        }

        public Builder template(String content) {
            this.templateContent = content;
            return this;
        }

        public Builder template(String content, String filename) {
            this.templateContent = content;
            this.templateFilename = Objects.requireNonNull(filename, "filename");
            return this;
        }

        public Builder annotation(String filename, String content) {
            annotationContents.put(Objects.requireNonNull(filename, "filename"), content);
            return this;
        }

        public Builder ontology(String filename, String content) {
            ontologyContents.put(Objects.requireNonNull(filename, "filename"), content);
            return this;
        }

        public Builder bibliography(Bibliography bibliography) {
            this.bibliography = bibliography;
            return this;
        }

        public InMemoryCompiler build() {
            return new InMemoryCompiler(this);
        }
    }
}
