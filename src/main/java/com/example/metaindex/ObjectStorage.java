package com.example.metaindex;

import java.util.Optional;

public interface ObjectStorage {

    Optional<byte[]> getBlob(String contentId);
}
