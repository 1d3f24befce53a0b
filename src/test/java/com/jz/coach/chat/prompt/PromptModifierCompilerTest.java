package com.jz.coach.chat.prompt;

import com.jz.coach.chat.directive.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptModifierCompilerTest {

    @Test
    @DisplayName("defaults compile to tone, length, subtle memory, avoid list and cognitive block")
    void defaults() {
        String out = PromptModifierCompiler.compile(ResponseDirectives.defaults());
        List<String> lines = List.of(out.split("\n", -1));

        assertEquals("Be warm and supportive. Natural and conversational.", lines.get(0));
        assertEquals("Keep your response concise. 2-4 sentences.", lines.get(1));
        assertEquals("If referencing past conversations, do it subtly. Don't quote the user directly.", lines.get(2));
        assertEquals("NEVER use these phrases: I understand, I hear you, That's completely valid, "
                + "That's totally understandable, It's okay to feel, etc.", lines.get(3));
        assertEquals("", lines.get(4));
        assertEquals("COGNITIVE STYLE ADAPTATIONS (how this person thinks):", lines.get(5));
        assertTrue(out.contains("- Give concrete examples and stories"));
        assertTrue(out.contains("- Always validate emotions FIRST before anything else"));
        assertTrue(out.contains("- Allow conversation to explore and wander - don't force structure"));
        assertFalse(out.contains("metaphors"));
        assertTrue(out.endsWith("- Ask open-ended questions that allow exploration"));
        // 默认最多 2 个问题：不输出提问限制
        assertFalse(out.substring(0, out.indexOf("COGNITIVE")).contains("question"));
    }

    @Test
    @DisplayName("crisis directives")
    void crisis() {
        ResponseDirectives d = ResponseDirectives.defaults();
        d.setTone(ResponseTone.GENTLE);
        d.setMaxLength(ResponseLength.BRIEF);
        d.disallowQuestions();
        d.disallowMemoryCallback();
        d.setInsertBreathingPrompt(true);
        d.setOpeningStyle(OpeningStyle.GENTLE_CHECKIN);

        String out = PromptModifierCompiler.compile(d);
        assertTrue(out.startsWith("Respond gently and softly. Use calming language. No pressure.\n"
                + "Keep your response SHORT. 1-2 sentences max. Less is more.\n"
                + "Do NOT ask questions. Just be present and supportive.\n"
                + "Do NOT reference past conversations. Focus on the present moment.\n"
                + "Gently offer a grounding technique or breathing exercise if appropriate.\n"
                + "Start with a gentle check-in."));
    }

    @Test
    @DisplayName("one question, explicit memory, nudge and break")
    void flags() {
        ResponseDirectives d = ResponseDirectives.defaults();
        d.setMaxQuestions(1);
        d.setMemoryCallbackStyle(MemoryCallbackStyle.EXPLICIT);
        d.setInsertAntiDependencyNudge(true);
        d.setSuggestBreak(true);

        String out = PromptModifierCompiler.compile(d);
        assertTrue(out.contains("Ask at most ONE question, and make it easy to answer."));
        assertTrue(out.contains("You may reference past conversations naturally when it genuinely helps."));
        assertTrue(out.contains("Subtly acknowledge this has been a long conversation."));
        assertTrue(out.contains("Gently suggest taking a break might be helpful. No pressure."));
    }

    @Test
    @DisplayName("short avoid list ends with a period, no etc.")
    void shortAvoidList() {
        ResponseDirectives d = ResponseDirectives.defaults();
        d.setAvoidPhrases(List.of("I hear you", "First of all"));
        assertTrue(PromptModifierCompiler.compile(d).contains("NEVER use these phrases: I hear you, First of all.\n"));
    }

    @Test
    @DisplayName("cognitive hints render each enabled preference")
    void cognitive() {
        ResponseDirectives d = ResponseDirectives.defaults();
        d.setCognitiveAdaptations(CognitiveAdaptations.builder()
                .useMetaphors(true).useExamples(false).useStepByStep(true).showBigPicture(true)
                .validateFirst(false).allowWandering(false).provideStructure(true).giveTimeToThink(true)
                .questionType(QuestionType.SPECIFIC).build());
        String block = PromptModifierCompiler.compile(d).split("COGNITIVE STYLE ADAPTATIONS \\(how this person thinks\\):\n")[1];
        assertEquals(String.join("\n",
                "- Use metaphors and analogies - they help this person understand",
                "- Be step-by-step and logical in explanations",
                "- Connect things to the bigger picture - show how it fits",
                "- Provide clear structure and organization",
                "- Don't ask rapid questions - give space to think",
                "- Ask specific, concrete questions"), block);
    }

    @Test
    @DisplayName("same directives → identical output")
    void deterministic() {
        assertEquals(PromptModifierCompiler.compile(ResponseDirectives.defaults()),
                PromptModifierCompiler.compile(ResponseDirectives.defaults()));
    }

    @Test
    @DisplayName("modifiers are appended after the base persona and hard rules")
    void inject() {
        String sys = CoachSystemPrompt.inject("You are Sam.", "Keep it short.");
        assertTrue(sys.startsWith("You are Sam.\n\n"));
        assertTrue(sys.endsWith("FOR THIS REPLY (internal guidance, never mention it):\nKeep it short."));
        assertFalse(CoachSystemPrompt.inject(null, "").contains("FOR THIS REPLY"));
    }
}
