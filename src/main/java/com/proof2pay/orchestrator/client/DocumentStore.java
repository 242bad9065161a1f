package com.proof2pay.orchestrator.client;

import java.util.List;

public interface DocumentStore {

    byte[] fetch(String ref);

    List<String> list(String folder);
}
