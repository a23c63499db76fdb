package eu.virtualparadox.ragqa.rag.retriever.model;

import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;

/**
 * @param passage the matched passage
 * @param score   cosine similarity to the query vector, in [-1, 1] (higher = better)
 */
public record ScoredPassage(EmbeddedPassage passage, double score) {

}
