package com.rewardpick.index.service;

import com.rewardpick.catalog.model.IndexDocument;

public record ScoredDocument(IndexDocument document, double similarity) {
}
