package com.example.transcribe_backend.engine.Interfaces;

import java.util.List;

public interface EmbeddingEngine {
    /**
     * @return one vector per input text, in input order.
     */
    List<List<Double>> embed(List<String> texts);

    String model();
}
