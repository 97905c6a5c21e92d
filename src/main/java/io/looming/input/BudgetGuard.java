package io.looming.input;

import io.looming.model.Act;

import java.util.List;

/**
 * Rejects acts whose max output tokens is implausibly small for the size of
 * their resolved input. Size is approximated as characters per token.
 */
public final class BudgetGuard {
    private final double minOutputTokenRatio;
    private final int charsPerToken;

    public BudgetGuard(double minOutputTokenRatio, int charsPerToken) {
        if (charsPerToken < 1) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        this.minOutputTokenRatio = Math.max(0d, minOutputTokenRatio);
        this.charsPerToken = charsPerToken;
    }

    public long approximateTokens(List<ResolvedContent> contents) {
        long chars = 0;
        for (ResolvedContent content : contents) {
            chars += content.text().length();
        }
        return chars / charsPerToken;
    }

    public void check(Act act, List<ResolvedContent> contents) throws InputException {
        Integer maxTokens = act.generation().maxTokens();
        if (maxTokens == null || minOutputTokenRatio == 0d) {
            return;
        }
        long inputTokens = approximateTokens(contents);
        double required = inputTokens * minOutputTokenRatio;
        if (maxTokens < required) {
            throw new InputException(InputException.Kind.BUDGET_TOO_SMALL, String.format(
                    "Act %s: max_tokens=%d is below %.0f (input ~%d tokens x ratio %.2f)",
                    act.name(), maxTokens, Math.ceil(required), inputTokens, minOutputTokenRatio));
        }
    }
}
