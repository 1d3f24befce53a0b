package com.jz.coach.chat.context;

import com.jz.coach.chat.signal.UserMood;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** 上一次会话结束时落下的记录，只用来算间隔和上次情绪 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionEndRecord {
    private Instant endTime;
    private UserMood mood;
}
