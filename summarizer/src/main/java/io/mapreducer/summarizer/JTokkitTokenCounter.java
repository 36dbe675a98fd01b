package io.mapreducer.summarizer;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import io.mapreducer.core.TokenCounter;
import io.mapreducer.core.TokenEncoding;

import java.util.EnumMap;
import java.util.Map;

/**
 * BPE token counts via jtokkit. Special-token markers in the text are counted as ordinary text.
 */
public class JTokkitTokenCounter implements TokenCounter {
    private final Map<TokenEncoding, Encoding> encodings = new EnumMap<>(TokenEncoding.class);

    public JTokkitTokenCounter() {
        this(Encodings.newLazyEncodingRegistry());
    }

    public JTokkitTokenCounter(EncodingRegistry registry) {
        encodings.put(TokenEncoding.O200K, registry.getEncoding(EncodingType.O200K_BASE));
        encodings.put(TokenEncoding.CL100K, registry.getEncoding(EncodingType.CL100K_BASE));
    }

    @Override
    public int count(String text, TokenEncoding encoding) {
        if (text == null || text.isEmpty()) return 0;
        return encodings.get(encoding == null ? TokenEncoding.O200K : encoding).countTokensOrdinary(text);
    }
}
