package com.jz.coach.chat.signal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SignalDetectorTest {

    @Nested
    @DisplayName("detectHeavyTopic()")
    class HeavyTopic {

        @Test
        @DisplayName("crisis pattern: I want to disappear")
        void wantToDisappear() {
            assertTrue(SignalDetector.detectHeavyTopic("I want to disappear"));
        }

        @Test
        @DisplayName("keyword match is case-insensitive")
        void keywordCaseInsensitive() {
            assertTrue(SignalDetector.detectHeavyTopic("My dad got a DIAGNOSIS today"));
        }

        @Test
        @DisplayName("curly apostrophe still matches can't ... anymore")
        void curlyApostrophe() {
            assertTrue(SignalDetector.detectHeavyTopic("I can’t do this anymore"));
        }

        @Test
        @DisplayName("ordinary message is not heavy")
        void ordinary() {
            assertFalse(SignalDetector.detectHeavyTopic("had pasta for lunch"));
        }

        @Test
        @DisplayName("adding more distress keywords or patterns never clears the flag")
        void monotonic() {
            String base = "I want to disappear";
            for (String k : SignalDetector.HEAVY_KEYWORDS) {
                assertTrue(SignalDetector.detectHeavyTopic(base + " " + k), k);
                assertTrue(SignalDetector.detectHeavyTopic(k + ". " + base), k);
            }
            assertTrue(SignalDetector.detectHeavyTopic(base + ", no point in living, everything is falling apart"));
        }

        @Test
        @DisplayName("null / blank → false")
        void blank() {
            assertFalse(SignalDetector.detectHeavyTopic(null));
            assertFalse(SignalDetector.detectHeavyTopic("   "));
        }
    }

    @Nested
    @DisplayName("detectUserEnergy()")
    class Energy {

        @Test
        @DisplayName("≤3 words without ! → LOW")
        void shortMessage() {
            assertEquals(UserEnergy.LOW, SignalDetector.detectUserEnergy("just so tired"));
        }

        @Test
        @DisplayName("short but excited → not LOW")
        void shortWithBang() {
            assertEquals(UserEnergy.HIGH, SignalDetector.detectUserEnergy("omg it worked!!"));
        }

        @Test
        @DisplayName("exclamations and high-energy words → HIGH")
        void high() {
            assertEquals(UserEnergy.HIGH,
                    SignalDetector.detectUserEnergy("I finally got the job, this is amazing!"));
        }

        @Test
        @DisplayName("low-energy words and ellipses → LOW")
        void low() {
            assertEquals(UserEnergy.LOW,
                    SignalDetector.detectUserEnergy("ugh I'm exhausted and drained... whatever"));
        }

        @Test
        @DisplayName("single-letter token only matches as a whole word")
        void wholeWordToken() {
            assertEquals(UserEnergy.MEDIUM,
                    SignalDetector.detectUserEnergy("I talked to my keeper about the weekend plans"));
        }

        @Test
        @DisplayName("null → LOW")
        void nullMessage() {
            assertEquals(UserEnergy.LOW, SignalDetector.detectUserEnergy(null));
        }
    }

    @Nested
    @DisplayName("detectUserMood()")
    class Mood {

        @Test
        void heavyIsDistressed() {
            assertEquals(UserMood.DISTRESSED, SignalDetector.detectUserMood("I got fired today"));
        }

        @Test
        void anxiousBeforePositive() {
            assertEquals(UserMood.ANXIOUS, SignalDetector.detectUserMood("good news but I'm nervous"));
        }

        @Test
        void positive() {
            assertEquals(UserMood.POSITIVE, SignalDetector.detectUserMood("feeling better today"));
        }

        @Test
        void calm() {
            assertEquals(UserMood.CALM, SignalDetector.detectUserMood("pretty relaxed evening"));
        }

        @Test
        void neutral() {
            assertEquals(UserMood.NEUTRAL, SignalDetector.detectUserMood("went to the store"));
        }
    }

    @Nested
    @DisplayName("extractTopics()")
    class Topics {

        @Test
        @DisplayName("tags are de-duplicated and keep first-seen order")
        void dedupOrdered() {
            Set<String> topics = SignalDetector.extractTopics("my boss and my job, plus my mom");
            assertEquals(List.of("work", "family"), List.copyOf(topics));
        }

        @Test
        void none() {
            assertTrue(SignalDetector.extractTopics("hello there").isEmpty());
        }
    }

    @Test
    @DisplayName("detectStockPhrases() finds phrases case-insensitively")
    void stockPhrases() {
        List<String> found = SignalDetector.detectStockPhrases("i understand. THANK YOU FOR SHARING that.");
        assertEquals(List.of("I understand", "Thank you for sharing"), found);
    }

    @Test
    @DisplayName("wordCount() splits on any whitespace")
    void wordCount() {
        assertEquals(0, SignalDetector.wordCount("  "));
        assertEquals(3, SignalDetector.wordCount(" a\tb \n c "));
    }
}
