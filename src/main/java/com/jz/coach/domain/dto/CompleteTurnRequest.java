package com.jz.coach.domain.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/** 一轮结束：在 prepare 的入参基础上带上实际回复，用于打分 */
@Data
@EqualsAndHashCode(callSuper = true)
public class CompleteTurnRequest extends CoachTurnRequest {
    private String aiResponse;
}
