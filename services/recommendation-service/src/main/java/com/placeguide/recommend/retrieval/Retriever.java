package com.placeguide.recommend.retrieval;

public interface Retriever {
    String name();

    RetrievalStageResult retrieve(RetrievalStageContext context);
}
