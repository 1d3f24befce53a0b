package com.jz.coach.chat.humanness;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** 一次交互的“像人”评分：总分 + 七维分项 + 问题 + 对应改进建议 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HumannessScore {
    private int total;
    private HumannessBreakdown breakdown;
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
}
