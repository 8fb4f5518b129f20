package com.binauditor.core.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed SPDX license expression ({@code MIT}, {@code Apache-2.0 OR GPL-2.0-only WITH
 * Classpath-exception-2.0}).
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 * expression := and ( OR and )*
 * and        := with ( AND with )*
 * with       := atom [ WITH exception-id ]
 * atom       := '(' expression ')' | license-id [ '+' ]
 * </pre>
 * License identifiers are checked against the bundled SPDX list, case-insensitively;
 * {@code LicenseRef-} and {@code DocumentRef-...:LicenseRef-} references are always accepted.
 * Parentheses may nest at most {@value #MAX_DEPTH} levels.
 */
public final class SpdxExpression {

    private static final Set<String> LICENSE_IDS = loadIds("spdx-license-ids.txt");
    private static final Set<String> EXCEPTION_IDS = loadIds("spdx-exception-ids.txt");
    private static final Pattern ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9.\\-]*");
    /** Deepest parenthesis nesting accepted. */
    public static final int MAX_DEPTH = 64;

    private static final Pattern LICENSE_REF = Pattern.compile("(DocumentRef-[A-Za-z0-9.\\-]+:)?LicenseRef-[A-Za-z0-9.\\-]+");

    private final String expression;
    private final List<String> licenseIds;

    private SpdxExpression(String expression, List<String> licenseIds) {
        this.expression = expression;
        this.licenseIds = List.copyOf(licenseIds);
    }

    /**
     * Parses and validates an expression.
     *
     * @param expression expression text
     * @return parsed expression
     * @throws IllegalArgumentException if the grammar is violated or an identifier is unknown
     */
    public static SpdxExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("License expression is empty");
        }
        Parser parser = new Parser(tokenize(expression));
        parser.expression();
        if (parser.position != parser.tokens.size()) {
            throw new IllegalArgumentException("Unexpected '" + parser.tokens.get(parser.position)
                + "' in license expression '" + expression + "'");
        }
        return new SpdxExpression(expression.strip(), parser.licenses);
    }

    public static boolean isKnownLicense(String id) {
        return LICENSE_IDS.contains(id.toLowerCase(Locale.ROOT)) || LICENSE_REF.matcher(id).matches();
    }

    public String expression() {
        return expression;
    }

    /**
     * License identifiers referenced by the expression, in order of appearance, without
     * {@code +} suffixes.
     */
    public List<String> licenseIds() {
        return licenseIds;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (char c : expression.toCharArray()) {
            if (c == '(' || c == ')' || Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
                if (!Character.isWhitespace(c)) {
                    tokens.add(String.valueOf(c));
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static Set<String> loadIds(String resource) {
        Set<String> ids = new LinkedHashSet<>();
        try (InputStream in = SpdxExpression.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + resource);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String id = line.strip();
                if (!id.isEmpty() && !id.startsWith("#")) {
                    ids.add(id.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return Set.copyOf(ids);
    }

    private static final class Parser {
        private final List<String> tokens;
        private final List<String> licenses = new ArrayList<>();
        private int position;
        private int depth;

        Parser(List<String> tokens) {
            this.tokens = tokens;
        }

        void expression() {
            and();
            while (acceptOperator("OR")) {
                and();
            }
        }

        private void and() {
            with();
            while (acceptOperator("AND")) {
                with();
            }
        }

        private void with() {
            atom();
            if (acceptOperator("WITH")) {
                String exception = next("exception identifier");
                if (!EXCEPTION_IDS.contains(exception.toLowerCase(Locale.ROOT))) {
                    throw new IllegalArgumentException("Unknown license exception '" + exception + "'");
                }
            }
        }

        private void atom() {
            String token = next("license identifier or '('");
            if (token.equals("(")) {
                if (++depth > MAX_DEPTH) {
                    throw new IllegalArgumentException("License expression nests deeper than " + MAX_DEPTH + " levels");
                }
                expression();
                depth--;
                if (!")".equals(next("')'"))) {
                    throw new IllegalArgumentException("Unbalanced parentheses in license expression");
                }
                return;
            }
            if (token.equals(")") || isOperator(token)) {
                throw new IllegalArgumentException("Expected license identifier but found '" + token + "'");
            }
            String id = token.endsWith("+") ? token.substring(0, token.length() - 1) : token;
            if (!ID.matcher(id).matches() && !LICENSE_REF.matcher(id).matches()) {
                throw new IllegalArgumentException("Malformed license identifier '" + token + "'");
            }
            if (!isKnownLicense(id)) {
                throw new IllegalArgumentException("Unrecognized SPDX license identifier '" + id + "'");
            }
            licenses.add(id);
        }

        private boolean acceptOperator(String operator) {
            if (position < tokens.size() && tokens.get(position).equalsIgnoreCase(operator)) {
                position++;
                return true;
            }
            return false;
        }

        private String next(String expected) {
            if (position >= tokens.size()) {
                throw new IllegalArgumentException("License expression ends where " + expected + " was expected");
            }
            return tokens.get(position++);
        }

        private static boolean isOperator(String token) {
            return token.equalsIgnoreCase("AND") || token.equalsIgnoreCase("OR") || token.equalsIgnoreCase("WITH");
        }
    }
}
