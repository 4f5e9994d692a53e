package com.subphot.stage;

import java.io.IOException;

/**
 * An external transform run synchronously for one task.
 */
public interface Transform {
    String name();

    /**
     * @return the process exit status; zero means the transform believes it succeeded
     */
    int execute(Task task) throws IOException, InterruptedException;
}
