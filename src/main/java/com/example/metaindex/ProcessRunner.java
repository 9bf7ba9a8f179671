package com.example.metaindex;

import java.io.IOException;
import java.util.List;

/**
 * Starts the external commands used by the content indexers ({@code nomossa}, {@code ctags}).
 * Tests replace it with a runner handing back a canned {@link Process}.
 */
public interface ProcessRunner {
    Process start(List<String> command) throws IOException;
}
