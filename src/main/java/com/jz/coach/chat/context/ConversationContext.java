package com.jz.coach.chat.context;

import com.jz.coach.chat.signal.UserEnergy;
import com.jz.coach.chat.signal.UserMood;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 单轮处理期间的会话上下文（每轮重建，用完即弃）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationContext {
    // 会话
    private String sessionId;
    private int messageCount;              // 用户发言轮数（含本轮）
    private Instant sessionStartTime;

    // 用户状态（由最新一条消息推断）
    @Builder.Default
    private UserEnergy userEnergy = UserEnergy.MEDIUM;
    @Builder.Default
    private UserMood userMood = UserMood.NEUTRAL;
    private boolean heavyTopic;
    @Builder.Default
    private String lastUserMessage = "";
    @Builder.Default
    private Set<String> recentTopics = new LinkedHashSet<>();

    // 时间
    @Builder.Default
    private double timeSinceLastSession = 24; // 小时
    private UserMood lastSessionMood;         // 可为空
    @Builder.Default
    private int dayOfWeek = 1;                // ISO：1=周一 … 7=周日
    private int hourOfDay;                    // 0~23

    // 记忆回调
    private int recentMemoryCallbacks;        // 本会话中助手提到过去的次数
    @Builder.Default
    private int lastMemoryCallbackTurn = -1;  // 最近一次回调所在的助手轮次，无则 -1
}
