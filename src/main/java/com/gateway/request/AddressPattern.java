package com.gateway.request;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.web.util.UriUtils;

/**
 * An address template such as {@code /pets/{petId}} compiled into an anchored regular
 * expression. Literal segments match exactly and each placeholder matches one non-empty
 * segment, so {@code /pets/{petId}} matches {@code /pets/123} but neither {@code /pets} nor
 * {@code /pets/123/extra}.
 */
public final class AddressPattern {

    static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

    private final String template;
    private final Pattern regex;
    private final List<String> names;
    private final int literalLength;

    private AddressPattern(String template, Pattern regex, List<String> names, int literalLength) {
        this.template = template;
        this.regex = regex;
        this.names = names;
        this.literalLength = literalLength;
    }

    public static AddressPattern compile(String template) {
        StringBuilder regex = new StringBuilder("^");
        List<String> names = new ArrayList<>();
        int literalLength = 0;
        int last = 0;
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            String literal = template.substring(last, matcher.start());
            if (!literal.isEmpty()) {
                regex.append(Pattern.quote(literal));
                literalLength += literal.length();
            }
            regex.append("([^/]+)");
            names.add(matcher.group(1));
            last = matcher.end();
        }
        String tail = template.substring(last);
        if (!tail.isEmpty()) {
            regex.append(Pattern.quote(tail));
            literalLength += tail.length();
        }
        regex.append('$');
        return new AddressPattern(template, Pattern.compile(regex.toString()), List.copyOf(names), literalLength);
    }

    public boolean matches(String address) {
        return regex.matcher(address).matches();
    }

    /**
     * Matches the address and returns the placeholder values, percent-decoded, keyed by name.
     */
    public Optional<Map<String, String>> match(String address) {
        Matcher matcher = regex.matcher(address);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            values.put(names.get(i), UriUtils.decode(matcher.group(i + 1), StandardCharsets.UTF_8));
        }
        return Optional.of(values);
    }

    public String template() {
        return template;
    }

    public List<String> parameterNames() {
        return names;
    }

    /**
     * The number of placeholders. Fewer placeholders means a more specific template.
     */
    public int placeholderCount() {
        return names.size();
    }

    public int literalLength() {
        return literalLength;
    }

    @Override
    public String toString() {
        return regex.pattern();
    }
}
