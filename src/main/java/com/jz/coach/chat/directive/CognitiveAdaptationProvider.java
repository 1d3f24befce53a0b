package com.jz.coach.chat.directive;

import java.util.Optional;

/** 认知画像适配提示的来源（外部协作方） */
public interface CognitiveAdaptationProvider {
    /** 没有画像或读取失败返回 empty，由调用方使用安全默认 */
    Optional<CognitiveAdaptations> adaptationsFor(String userKey);
}
