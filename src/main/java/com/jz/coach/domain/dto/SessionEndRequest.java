package com.jz.coach.domain.dto;

import com.jz.coach.chat.signal.UserMood;
import lombok.Data;

@Data
public class SessionEndRequest {
    private String userKey;
    /** 可选：不传则按最后一条用户发言推断 */
    private UserMood mood;
    private String lastUserMessage;
}
