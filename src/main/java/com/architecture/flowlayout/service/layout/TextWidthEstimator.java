package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.config.LayoutSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Approximates rendered label width without font metrics.
 * CJK and full-width characters count as two units, everything else as one.
 */
@Component
@RequiredArgsConstructor
public class TextWidthEstimator {

    private final LayoutSettings settings;

    public double estimateWidth(String label) {
        return units(label) * settings.getCharWidth() + 2 * settings.getLabelPadding();
    }

    public int units(String label) {
        if (label == null || label.isEmpty()) {
            return 0;
        }
        int units = 0;
        for (int i = 0; i < label.length(); ) {
            int codePoint = label.codePointAt(i);
            units += isWide(codePoint) ? 2 : 1;
            i += Character.charCount(codePoint);
        }
        return units;
    }

    static boolean isWide(int codePoint) {
        if (codePoint >= 0xFF01 && codePoint <= 0xFF60 || codePoint >= 0xFFE0 && codePoint <= 0xFFE6) {
            return true;
        }
        if (Character.UnicodeBlock.of(codePoint) == Character.UnicodeBlock.HALFWIDTH_AND_FULLWIDTH_FORMS) {
            return false; // half-width katakana and hangul
        }
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        switch (script) {
            case HAN:
            case HIRAGANA:
            case KATAKANA:
            case HANGUL:
                return true;
            default:
                break;
        }
        Character.UnicodeBlock block = Character.UnicodeBlock.of(codePoint);
        return block == Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION
                || block == Character.UnicodeBlock.CJK_COMPATIBILITY_FORMS
                || block == Character.UnicodeBlock.ENCLOSED_CJK_LETTERS_AND_MONTHS;
    }
}
