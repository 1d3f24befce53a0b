package com.jz.coach.chat.directive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 认知画像给出的表达偏好（外部提供，原样合并进指令，本模块不自行推断）。
 * 字段默认值即“画像不可用”时的安全默认。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CognitiveAdaptations {
    private boolean useMetaphors;
    @Builder.Default
    private boolean useExamples = true;
    private boolean useStepByStep;
    private boolean showBigPicture;
    @Builder.Default
    private boolean validateFirst = true;
    @Builder.Default
    private boolean allowWandering = true;
    private boolean provideStructure;
    private boolean giveTimeToThink;
    @Builder.Default
    private QuestionType questionType = QuestionType.OPEN;

    public static CognitiveAdaptations defaults() {
        return CognitiveAdaptations.builder().build();
    }
}
