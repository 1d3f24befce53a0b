package com.jz.coach.domain.dto;

import com.jz.coach.chat.humanness.HumannessScore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoachReplyDTO {
    private String text;
    /** 建议延时（毫秒） */
    private int delayMs;
    /** 本地打分结果；评估模型的分数稍后异步入库 */
    private HumannessScore localScore;
    private String exchangeId;

    public static CoachReplyDTO reply(String text, int delayMs, HumannessScore score, String exchangeId) {
        return CoachReplyDTO.builder().text(text).delayMs(delayMs).localScore(score).exchangeId(exchangeId).build();
    }
}
