package com.synesis.loader.ast;

public sealed interface BlockNode
        permits ProjectNode,
                SourceNode,
                ItemNode,
                OntologyNode,
                TemplateHeaderNode,
                FieldRequirementsNode,
                FieldSpec {

    SourceLocation getLocation();
}
