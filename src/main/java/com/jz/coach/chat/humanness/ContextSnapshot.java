package com.jz.coach.chat.humanness;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.signal.UserEnergy;
import com.jz.coach.chat.signal.UserMood;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** 落库用的精简上下文：精力 / 情绪 / 轮次 / 小时 */
@Value
@Builder
@Jacksonized
public class ContextSnapshot {
    @Builder.Default
    UserEnergy userEnergy = UserEnergy.MEDIUM;
    @Builder.Default
    UserMood userMood = UserMood.NEUTRAL;
    @Builder.Default
    int messageCount = 1;
    int hourOfDay;

    public static ContextSnapshot of(ConversationContext ctx) {
        return ContextSnapshot.builder()
                .userEnergy(ctx.getUserEnergy() == null ? UserEnergy.MEDIUM : ctx.getUserEnergy())
                .userMood(ctx.getUserMood() == null ? UserMood.NEUTRAL : ctx.getUserMood())
                .messageCount(ctx.getMessageCount())
                .hourOfDay(ctx.getHourOfDay())
                .build();
    }
}
