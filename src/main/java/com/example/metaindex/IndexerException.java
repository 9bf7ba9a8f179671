package com.example.metaindex;

/**
 * Base of the data-shape errors raised by the indexing core. These are terminal for the
 * unit of work that raised them; infrastructure failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s instead.
 */
public class IndexerException extends RuntimeException {

    public IndexerException(String message) {
        super(message);
    }

    public IndexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
