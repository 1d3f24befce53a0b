package com.jz.coach.chat.humanness.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueCount {
    private String issue;
    private int count;
}
