package com.fixguard.core.proposal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a FixProposal from the generator's free-text answer.
 *
 * Expected shape (see FixPromptBuilder):
 *
 *     DIAGNOSIS: <one-line root cause>
 *
 *     CONFIDENCE: <0.0-1.0>
 *
 *     FIX:
 *     ```typescript
 *     <complete file>
 *     ```
 *
 * Required: the fenced code block and the DIAGNOSIS (or ROOT CAUSE) line.
 * The markers may also follow the block; text inside the block is never read for them.
 * Optional: CONFIDENCE. When absent, the configured default applies. Values above 1
 * are read as percentages. The result is clamped to [0, 1].
 */
@Component
public class ProposalParser {

    private static final Logger log = LoggerFactory.getLogger(ProposalParser.class);

    private static final Pattern CODE_BLOCK =
        Pattern.compile("```(?:typescript|ts)?[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);

    private static final Pattern DIAGNOSIS =
        Pattern.compile("(?:DIAGNOSIS|ROOT CAUSE):\\s*(.+?)(?:\\r?\\n\\s*\\r?\\n|FIX:|CONFIDENCE:|```|$)",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CONFIDENCE =
        Pattern.compile("CONFIDENCE:\\s*(\\d+(?:\\.\\d+)?)\\s*%?", Pattern.CASE_INSENSITIVE);

    private final double defaultConfidence;

    public ProposalParser(
            @Value("${fixguard.proposal.default-confidence:0.5}") double defaultConfidence
    ) {
        this.defaultConfidence = defaultConfidence;
    }

    public FixProposal parse(String rawText) throws ProposalParseException {

        if (rawText == null || rawText.isBlank()) {
            throw new ProposalParseException("Empty response from proposal generator");
        }

        Matcher code = CODE_BLOCK.matcher(rawText);
        if (!code.find() || code.group(1).isBlank()) {
            throw new ProposalParseException("Could not extract fixed code from AI response");
        }
        String fixedContent = code.group(1);

        // Markers are read around the code block, never inside it; text before the block wins
        String surrounding = rawText.substring(0, code.start()) + "\n\n" + rawText.substring(code.end());

        Matcher diagnosisMatcher = DIAGNOSIS.matcher(surrounding);
        if (!diagnosisMatcher.find() || diagnosisMatcher.group(1).isBlank()) {
            throw new ProposalParseException("Could not extract diagnosis from AI response");
        }
        String diagnosis = diagnosisMatcher.group(1).strip();

        double  confidence = defaultConfidence;
        boolean reported   = false;

        Matcher confidenceMatcher = CONFIDENCE.matcher(surrounding);
        if (confidenceMatcher.find()) {
            try {
                confidence = Double.parseDouble(confidenceMatcher.group(1));
                if (confidence > 1.0) confidence = confidence / 100.0;
                reported = true;
            } catch (NumberFormatException e) {
                log.warn("[ProposalParser] Unreadable confidence '{}', using default {}",
                        confidenceMatcher.group(1), defaultConfidence);
            }
        } else {
            log.warn("[ProposalParser] No CONFIDENCE marker, using default {}", defaultConfidence);
        }

        FixProposal proposal = new FixProposal(diagnosis, confidence, fixedContent, reported);
        log.info("[ProposalParser] Parsed {}", proposal);
        return proposal;
    }
}
