package com.synesis.compiler;

import com.synesis.loader.semantic.Bibliography;
import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface BibliographyLoader {

    Bibliography load(Path path) throws IOException;
}
