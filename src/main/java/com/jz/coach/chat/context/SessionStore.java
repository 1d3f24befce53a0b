package com.jz.coach.chat.context;

import com.jz.coach.chat.signal.UserMood;

import java.util.Optional;

public interface SessionStore {
    /** 读取上一次会话结束记录；没有或读失败都返回 empty */
    Optional<SessionEndRecord> findLastSessionEnd(String userKey);

    /** 记下本次会话结束（时间取当前时刻） */
    void saveSessionEnd(String userKey, UserMood mood);
}
