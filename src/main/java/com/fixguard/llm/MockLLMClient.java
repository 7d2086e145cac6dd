package com.fixguard.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline stub: answers every repair prompt with the test file it was given, unchanged,
 * so a mock run exercises the whole pipeline without ever altering a test.
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    private static final Pattern CURRENT_CODE =
        Pattern.compile("CURRENT TEST CODE:\\s*```(?:typescript|ts)?\\n(.*?)```", Pattern.DOTALL);

    @Override
    public LlmCompletion generate(String prompt, double temperature) {
        Matcher matcher = CURRENT_CODE.matcher(prompt);
        String  code    = matcher.find() ? matcher.group(1) : "// mock fix\n";

        String text = """
                DIAGNOSIS: Mock diagnosis, no change proposed

                CONFIDENCE: 0.9

                FIX:
                ```typescript
                """ + code + "```\n";

        return new LlmCompletion(text, prompt.length() / 4, text.length() / 4, getModelName());
    }

    @Override
    public String getModelName() {
        return "mock";
    }
}
