package com.prodomme.workspace;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source of the project file listing shown to the model and of the root that tool
 * paths resolve against.
 */
public interface ProjectTree {

    /**
     * @return newline-delimited, project-relative file paths
     */
    String getTree() throws IOException;

    /**
     * @throws java.io.FileNotFoundException if the directory is not inside a git repository
     */
    Path getGitRoot() throws IOException;
}
