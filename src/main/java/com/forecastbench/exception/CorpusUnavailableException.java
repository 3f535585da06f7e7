package com.forecastbench.exception;

import java.nio.file.Path;

public class CorpusUnavailableException extends BenchmarkException {
    public CorpusUnavailableException(Path path) {
        super("CORPUS_UNAVAILABLE",
              "M4 corpus file '" + path + "' is missing. Build the cache before evaluating.");
    }
    public CorpusUnavailableException(Path path, Throwable cause) {
        super("CORPUS_UNAVAILABLE", "M4 corpus file '" + path + "' could not be read.", cause);
    }
}
