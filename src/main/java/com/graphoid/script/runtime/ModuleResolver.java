package com.graphoid.script.runtime;

import java.nio.file.Path;

/** Maps an {@code import}/{@code load} path to a file. Hosts may replace the file-system default. */
@FunctionalInterface
public interface ModuleResolver {
    /**
     * @param spec        the path as written in the script
     * @param currentFile file executing the import, null for top-level source
     * @return the resolved file, or null when nothing matches
     */
    Path resolve(String spec, Path currentFile);
}
