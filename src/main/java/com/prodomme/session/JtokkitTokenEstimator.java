package com.prodomme.session;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Byte-pair token counts. Defaults to the GPT-2 vocabulary (r50k_base).
 */
public class JtokkitTokenEstimator implements TokenEstimator {

    private final Encoding encoding;

    public JtokkitTokenEstimator() {
        this(EncodingType.R50K_BASE);
    }

    public JtokkitTokenEstimator(EncodingType type) {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(type);
    }

    @Override
    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
