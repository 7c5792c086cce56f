package com.lumina.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A workspace passage judged relevant to the task, injected into the first user message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RagResult {

    private String filePath;
    private String content;
    private double score;
    private String heading;
}
