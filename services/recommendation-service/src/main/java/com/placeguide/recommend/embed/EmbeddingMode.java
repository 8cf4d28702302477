package com.placeguide.recommend.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
