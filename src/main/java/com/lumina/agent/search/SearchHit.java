package com.lumina.agent.search;

public record SearchHit(String filePath, String content, double score, String heading) {
}
