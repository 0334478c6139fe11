package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepairSummary {

    private String userId;
    private int examined;
    private int updated;
    private int skipped;

    public static RepairSummary empty(String userId) {
        return RepairSummary.builder().userId(userId).build();
    }
}
