package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.Platform;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.bands.BandCheck;
import com.dcruver.goldenset.domain.bands.BandClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural, platform, band, PII and code-style checks for a candidate spec.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpecStructureValidator implements SpecValidator {

    public static final List<String> REQUIRED_SECTIONS = List.of(
        "Vision", "Tech Stack", "Data Models", "Pages & Routes", "Feature Plan", "NFR & SLOs");

    static final int MAX_CODE_BLOCKS = 3;
    static final int MAX_CODE_LINES = 40;

    private static final Pattern H2 = Pattern.compile("^##\\s+(.+?)\\s*$", Pattern.MULTILINE);
    private static final Pattern MEMBER_ROLE = Pattern.compile("\\*\\*Member\\*\\*:.*?`read:self`.*?`write:self`", Pattern.DOTALL);
    private static final Pattern ADMIN_ROLE = Pattern.compile("\\*\\*Admin\\*\\*:.*?`read:any`.*?`write:any`.*?`manage`", Pattern.DOTALL);
    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:[a-zA-Z]*\\n)?(.*?)```", Pattern.DOTALL);

    private static final Map<String, Pattern> PII = new LinkedHashMap<>();
    static {
        PII.put("email", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"));
        PII.put("phone", Pattern.compile("\\b(?:\\+\\d{1,3}[- ]?)?\\(?\\d{3}\\)?[- ]?\\d{3}[- ]?\\d{4}\\b"));
    }

    private static final Pattern HOSTING = Pattern.compile("\\bhosting\\b", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> BANNED_NETWORK_TERMS = List.of(
        Pattern.compile("\\bserver(?!less)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bsockets?\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bbind(?:ing)?\\s+0\\.0\\.0\\.0\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(?:listen|port)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bhost\\b", Pattern.CASE_INSENSITIVE));

    private final BandClassifier bands;
    private final CurationProperties properties;

    @Override
    public ValidationOutcome validate(SpecItem item) {
        String spec = item.getSpec() == null ? "" : item.getSpec();
        List<String> errors = new ArrayList<>();
        SpecItem corrected = item;

        checkSections(spec, errors);
        checkAccessControl(spec, errors);
        checkPlatform(item.getPlatform(), spec, errors);

        BandCheck band = bands.validateBand(item);
        if (!band.isValid()) {
            errors.add("BAND_ERR: " + band.getMessage());
            if (band.getActual() != null) {
                corrected = item.withLengthBand(band.getActual());
            }
        }

        Set<String> piiTypes = findPii(spec);
        if (!piiTypes.isEmpty()) {
            errors.add("PII_ERR: Found potential PII: " + String.join(", ", piiTypes));
        }

        CodeStyle style = codeStyle(spec);
        if (style.blocks() > MAX_CODE_BLOCKS || style.lines() > MAX_CODE_LINES) {
            errors.add(String.format("STYLE_ERR: Code blocks (%d) or lines (%d) exceed limits (max %d blocks, %d lines)",
                style.blocks(), style.lines(), MAX_CODE_BLOCKS, MAX_CODE_LINES));
        }

        if (errors.isEmpty()) {
            return ValidationOutcome.accept(corrected);
        }
        log.debug("Candidate {} failed validation: {}", item.getCandidateId(), errors);
        return ValidationOutcome.reject(corrected, errors);
    }

    /**
     * H2 header to section body, in document order
     */
    public static Map<String, String> sections(String spec) {
        Map<String, String> sections = new LinkedHashMap<>();
        Matcher matcher = H2.matcher(spec);
        String header = null;
        int bodyStart = 0;
        while (matcher.find()) {
            if (header != null) {
                sections.merge(header, spec.substring(bodyStart, matcher.start()).strip(), (a, b) -> a + "\n" + b);
            }
            header = matcher.group(1);
            bodyStart = matcher.end();
        }
        if (header != null) {
            sections.merge(header, spec.substring(bodyStart).strip(), (a, b) -> a + "\n" + b);
        }
        return sections;
    }

    private void checkSections(String spec, List<String> errors) {
        List<String> headers = new ArrayList<>();
        Matcher matcher = H2.matcher(spec);
        while (matcher.find()) {
            headers.add(matcher.group(1));
        }
        Set<String> missing = new TreeSet<>(REQUIRED_SECTIONS);
        headers.forEach(missing::remove);
        Set<String> extra = new TreeSet<>(headers);
        REQUIRED_SECTIONS.forEach(extra::remove);
        Set<String> repeated = new TreeSet<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String header : headers) {
            if (!seen.add(header)) {
                repeated.add(header);
            }
        }

        if (!missing.isEmpty() || !extra.isEmpty() || !repeated.isEmpty()) {
            StringBuilder sb = new StringBuilder("SECTION_ERR:");
            if (!missing.isEmpty()) {
                sb.append(" missing ").append(missing);
            }
            if (!extra.isEmpty()) {
                sb.append(" extra ").append(extra);
            }
            if (!repeated.isEmpty()) {
                sb.append(" repeated ").append(repeated);
            }
            errors.add(sb.toString());
            return;
        }

        List<String> empty = sections(spec).entrySet().stream()
            .filter(e -> e.getValue().isBlank())
            .map(Map.Entry::getKey)
            .toList();
        if (!empty.isEmpty()) {
            errors.add("SECTION_ERR: empty sections " + empty);
        }
    }

    private void checkAccessControl(String spec, List<String> errors) {
        if (!spec.contains("### Access Control")) {
            errors.add("ACL_ERR: Missing Access Control section");
            return;
        }
        if (!MEMBER_ROLE.matcher(spec).find()) {
            errors.add("ACL_ERR: Missing required Member permissions (read:self, write:self)");
        }
        if (!ADMIN_ROLE.matcher(spec).find()) {
            errors.add("ACL_ERR: Missing required Admin permissions (read:any, write:any, manage)");
        }
    }

    private void checkPlatform(Platform platform, String spec, List<String> errors) {
        if (platform == null) {
            errors.add("PLATFORM_ERR: Missing platform");
            return;
        }
        if (!properties.getPlatform().equals(platform.getName())) {
            errors.add("PLATFORM_ERR: Platform name must be '" + properties.getPlatform() + "'");
        }
        if (platform.isServer() && !Platform.WILDCARD_BIND.equals(platform.getBind())) {
            errors.add("PLATFORM_ERR: A server spec must bind " + Platform.WILDCARD_BIND);
        }
        if (!platform.isServer()) {
            if (platform.getBind() != null) {
                errors.add("PLATFORM_ERR: A static spec must not bind");
            }
            if (containsBannedNetworkTerms(spec)) {
                errors.add("PLATFORM_ERR: Static spec mentions network binding terms");
            }
        }
    }

    static boolean containsBannedNetworkTerms(String text) {
        String scrubbed = HOSTING.matcher(text).replaceAll("");
        return BANNED_NETWORK_TERMS.stream().anyMatch(p -> p.matcher(scrubbed).find());
    }

    static Set<String> findPii(String text) {
        Set<String> types = new LinkedHashSet<>();
        PII.forEach((type, pattern) -> {
            if (pattern.matcher(text).find()) {
                types.add(type);
            }
        });
        return types;
    }

    static CodeStyle codeStyle(String text) {
        Matcher matcher = CODE_BLOCK.matcher(text);
        int blocks = 0;
        int lines = 0;
        while (matcher.find()) {
            blocks++;
            for (String line : matcher.group(1).split("\n")) {
                if (!line.isBlank()) {
                    lines++;
                }
            }
        }
        return new CodeStyle(blocks, lines);
    }

    record CodeStyle(int blocks, int lines) {
    }
}
