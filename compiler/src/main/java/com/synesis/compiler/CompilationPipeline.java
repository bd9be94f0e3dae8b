package com.synesis.compiler;

import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.BlockNode;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.SynesisDocument;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.Bibliography;
import com.synesis.loader.semantic.ItemFieldBinder;
import com.synesis.loader.semantic.LinkedProject;
import com.synesis.loader.semantic.Linker;
import com.synesis.loader.semantic.SemanticValidator;
import com.synesis.loader.validation.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

final class CompilationPipeline {
    private static final Logger LOG = Logger.getLogger(CompilationPipeline.class.getName());

    private final ProjectNode project;
    private final TemplateNode template;
    private final Bibliography bibliography;
    private final List<SourceNode> sources = new ArrayList<>();
    private final List<ItemNode> items = new ArrayList<>();
    private final List<OntologyNode> ontologies = new ArrayList<>();

    CompilationPipeline(ProjectNode project, TemplateNode template, Bibliography bibliography) {
        this.project = project;
        this.template = template;
        this.bibliography = bibliography;
    }

    static ProjectNode requireProject(SynesisDocument document) throws SynesisSyntaxException {
        List<ProjectNode> projects = document.getProjects();
        if (projects.isEmpty()) {
            throw new SynesisSyntaxException(
                    SourceLocation.startOf(document.getSourceName()),
                    "Nenhum bloco PROJECT encontrado em " + document.getSourceName());
        }
        return projects.get(0);
    }

    void addOntologies(SynesisDocument document) {
        ontologies.addAll(document.getOntologies());
    }

    void addAnnotations(SynesisDocument document) {
        for (BlockNode block : document.getBlocks()) {
            if (block instanceof SourceNode) {
                sources.add((SourceNode) block);
            } else if (block instanceof ItemNode) {
                items.add((ItemNode) block);
            }
        }
    }

    CompilationResult run() {
        new ItemFieldBinder(template).bindAll(items);

        SemanticValidator validator =
                new SemanticValidator(template, bibliography, SemanticValidator.indexOntologies(ontologies));
        ValidationResult result = new ValidationResult();
        result.addAll(validator.validateProject(project).getAll());
        for (SourceNode source : sources) {
            result.addAll(validator.validateSource(source).getAll());
        }
        for (ItemNode item : items) {
            result.addAll(validator.validateItem(item).getAll());
        }
        for (OntologyNode ontology : ontologies) {
            result.addAll(validator.validateOntology(ontology).getAll());
        }

        Linker linker = new Linker(sources, items, ontologies, project, template);
        LinkedProject linked = linker.link();
        ValidationResult merged = result.merge(linker.getValidationResult());

        int chainCount = 0;
        for (ItemNode item : items) {
            chainCount += item.getChains().size();
        }
        CompilationStats stats =
                new CompilationStats(
                        sources.size(),
                        items.size(),
                        ontologies.size(),
                        linked.getOntologyIndex().size(),
                        chainCount,
                        linked.getAllTriples().size());
        LOG.fine(() -> "Compiled project '" + project.getName() + "': " + stats + ", " + merged);
        return new CompilationResult(linked, merged, stats, template, bibliography);
    }
}
