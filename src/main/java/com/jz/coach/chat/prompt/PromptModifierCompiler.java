package com.jz.coach.chat.prompt;

import com.jz.coach.chat.directive.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 把 {@link ResponseDirectives} 编译成注入 System 的指令块。
 * 纯函数：同一份指令永远得到逐字节相同的字符串。
 */
public final class PromptModifierCompiler {
    private PromptModifierCompiler() {}

    /** 套话清单只列前几条，其余用 etc. 带过 */
    static final int AVOID_PREVIEW = 5;

    private static final Map<ResponseTone, String> TONE = new EnumMap<>(ResponseTone.class);
    private static final Map<ResponseLength, String> LENGTH = new EnumMap<>(ResponseLength.class);
    private static final Map<OpeningStyle, String> OPENING = new EnumMap<>(OpeningStyle.class);
    private static final Map<QuestionType, String> QUESTION_TYPE = new EnumMap<>(QuestionType.class);
    static {
        TONE.put(ResponseTone.GENTLE, "Respond gently and softly. Use calming language. No pressure.");
        TONE.put(ResponseTone.WARM, "Be warm and supportive. Natural and conversational.");
        TONE.put(ResponseTone.ENERGETIC, "Match the user's energy. Be upbeat but not fake.");
        TONE.put(ResponseTone.DIRECT, "Be clear and straightforward. No fluff.");
        TONE.put(ResponseTone.PLAYFUL, "Allow some lightness and humor if appropriate.");

        LENGTH.put(ResponseLength.BRIEF, "Keep your response SHORT. 1-2 sentences max. Less is more.");
        LENGTH.put(ResponseLength.MODERATE, "Keep your response concise. 2-4 sentences.");
        LENGTH.put(ResponseLength.DETAILED, "You can be more detailed if helpful, but stay focused.");

        OPENING.put(OpeningStyle.GENTLE_CHECKIN,
                "Start with a gentle check-in. Something like \"How are you holding up?\" or \"Been thinking about you.\"");
        OPENING.put(OpeningStyle.ENERGY_MATCH, "Open by matching the user's energy before anything else.");
        OPENING.put(OpeningStyle.GROUNDING, "Open with something grounding and steady. Slow the pace down.");

        QUESTION_TYPE.put(QuestionType.OPEN, "- Ask open-ended questions that allow exploration");
        QUESTION_TYPE.put(QuestionType.SPECIFIC, "- Ask specific, concrete questions");
        QUESTION_TYPE.put(QuestionType.REFLECTIVE, "- Ask reflective questions that invite introspection");
    }

    public static String compile(ResponseDirectives d) {
        List<String> lines = new ArrayList<>();

        lines.add(TONE.getOrDefault(d.getTone(), TONE.get(ResponseTone.WARM)));
        lines.add(LENGTH.getOrDefault(d.getMaxLength(), LENGTH.get(ResponseLength.MODERATE)));

        // 提问
        if (!d.isAllowQuestions()) {
            lines.add("Do NOT ask questions. Just be present and supportive.");
        } else if (d.getMaxQuestions() == 1) {
            lines.add("Ask at most ONE question, and make it easy to answer.");
        }

        // 记忆
        if (!d.isAllowMemoryCallback() || d.getMemoryCallbackStyle() == MemoryCallbackStyle.NONE) {
            lines.add("Do NOT reference past conversations. Focus on the present moment.");
        } else if (d.getMemoryCallbackStyle() == MemoryCallbackStyle.SUBTLE) {
            lines.add("If referencing past conversations, do it subtly. Don't quote the user directly.");
        } else {
            lines.add("You may reference past conversations naturally when it genuinely helps.");
        }

        // 特殊行为
        if (d.isInsertBreathingPrompt()) {
            lines.add("Gently offer a grounding technique or breathing exercise if appropriate.");
        }
        if (d.isInsertAntiDependencyNudge()) {
            lines.add("Subtly acknowledge this has been a long conversation. Validate any progress made.");
        }
        if (d.isSuggestBreak()) {
            lines.add("Gently suggest taking a break might be helpful. No pressure.");
        }

        String opening = OPENING.get(d.getOpeningStyle());
        if (opening != null) lines.add(opening);

        List<String> avoid = d.getAvoidPhrases();
        if (avoid != null && !avoid.isEmpty()) {
            List<String> head = avoid.subList(0, Math.min(AVOID_PREVIEW, avoid.size()));
            lines.add("NEVER use these phrases: " + String.join(", ", head)
                    + (avoid.size() > AVOID_PREVIEW ? ", etc." : "."));
        }

        CognitiveAdaptations cog = d.getCognitiveAdaptations();
        if (cog != null) {
            lines.add("");
            lines.add("COGNITIVE STYLE ADAPTATIONS (how this person thinks):");
            if (cog.isUseMetaphors())     lines.add("- Use metaphors and analogies - they help this person understand");
            if (cog.isUseExamples())      lines.add("- Give concrete examples and stories");
            if (cog.isUseStepByStep())    lines.add("- Be step-by-step and logical in explanations");
            if (cog.isShowBigPicture())   lines.add("- Connect things to the bigger picture - show how it fits");
            if (cog.isValidateFirst())    lines.add("- Always validate emotions FIRST before anything else");
            if (cog.isAllowWandering())   lines.add("- Allow conversation to explore and wander - don't force structure");
            if (cog.isProvideStructure()) lines.add("- Provide clear structure and organization");
            if (cog.isGiveTimeToThink())  lines.add("- Don't ask rapid questions - give space to think");
            QuestionType qt = cog.getQuestionType() == null ? QuestionType.OPEN : cog.getQuestionType();
            lines.add(QUESTION_TYPE.get(qt));
        }

        return String.join("\n", lines);
    }
}
