package com.jz.coach.chat.humanness.store;

/** 是否攒够评估模型样本去训练本地打分模型（只报告，不训练） */
public record TrainingReadiness(boolean ready, long evaluatorExamples, int needed) {}
