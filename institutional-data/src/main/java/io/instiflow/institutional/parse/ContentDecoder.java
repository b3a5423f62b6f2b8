package io.instiflow.institutional.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes publisher payloads by trying a fixed list of encodings in order and keeping the first that
 * decodes cleanly. Decoding is strict: nothing is replaced or skipped.
 */
public class ContentDecoder {
    private static final Logger log = LoggerFactory.getLogger(ContentDecoder.class);
    private static final char BOM = '\uFEFF';

    /** Text plus the name of the encoding that produced it. */
    public record DecodedText(String text, String encoding) {}

    private record Candidate(String name, Charset charset, boolean stripBom) {}

    private final List<Candidate> candidates;

    public ContentDecoder() {
        List<Candidate> list = new ArrayList<>();
        list.add(new Candidate("utf-8-sig", StandardCharsets.UTF_8, true));
        list.add(new Candidate("utf-8", StandardCharsets.UTF_8, false));
        addIfSupported(list, "big5", "Big5");
        addIfSupported(list, "cp950", "x-windows-950");
        this.candidates = List.copyOf(list);
    }

    public List<String> encodings() {
        return candidates.stream().map(Candidate::name).toList();
    }

    public DecodedText decode(byte[] content) throws DecodeException {
        for (Candidate c : candidates) {
            try {
                String text = c.charset().newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(content))
                        .toString();
                if (c.stripBom() && !text.isEmpty() && text.charAt(0) == BOM) text = text.substring(1);
                return new DecodedText(text, c.name());
            } catch (CharacterCodingException e) {
                log.debug("Payload is not valid {}", c.name());
            }
        }
        throw new DecodeException("Payload of " + content.length + " bytes matches none of " + encodings());
    }

    private static void addIfSupported(List<Candidate> list, String name, String charsetName) {
        if (Charset.isSupported(charsetName)) {
            list.add(new Candidate(name, Charset.forName(charsetName), false));
        } else {
            log.warn("Charset {} is not available in this JVM, {} decoding disabled", charsetName, name);
        }
    }
}
