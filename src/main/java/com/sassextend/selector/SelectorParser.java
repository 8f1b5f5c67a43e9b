package com.sassextend.selector;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class SelectorParser {

    /**
     * Parses a comma separated selector list; commas inside brackets or parentheses don't split.
     */
    public MutableList<ComplexSelector> parseList(String selectorList) {
        if (selectorList == null || selectorList.isBlank()) {
            throw new SelectorSyntaxException("Empty selector list", String.valueOf(selectorList), 0);
        }
        MutableList<ComplexSelector> selectors = Lists.mutable.empty();
        int start = 0;
        int comma;
        while ((comma = findTopLevel(selectorList, ',', start)) != -1) {
            selectors.add(parse(selectorList.substring(start, comma)));
            start = comma + 1;
        }
        selectors.add(parse(selectorList.substring(start)));
        return selectors;
    }

    public ComplexSelector parse(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new SelectorSyntaxException("Empty selector", String.valueOf(selector), 0);
        }

        ComplexSelector first = null;
        Combinator pending = Combinator.DESCENDANT;
        boolean explicitCombinator = false;
        int i = 0;
        while (i < selector.length()) {
            char c = selector.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (isCombinatorChar(c)) {
                if (explicitCombinator) {
                    throw new SelectorSyntaxException("Consecutive combinators", selector, i);
                }
                pending = Combinator.fromSymbol(String.valueOf(c));
                explicitCombinator = true;
                i++;
                continue;
            }

            int end = scanCompound(selector, i);
            if (end == i) {
                throw new SelectorSyntaxException("Unexpected character '" + c + "'", selector, i);
            }
            CompoundSelector compound = parseCompound(selector, i, end);
            ComplexSelector link = new ComplexSelector(pending, compound, null);
            if (first == null) {
                first = link;
            } else {
                first.append(link);
            }
            pending = Combinator.DESCENDANT;
            explicitCombinator = false;
            i = end;
        }

        if (explicitCombinator) {
            throw new SelectorSyntaxException("Trailing combinator", selector, selector.length());
        }
        if (first == null) {
            throw new SelectorSyntaxException("Selector has no compound selectors", selector, 0);
        }
        return first;
    }

    public CompoundSelector parseCompound(String compound) {
        if (compound == null || compound.isBlank()) {
            throw new SelectorSyntaxException("Empty compound selector", String.valueOf(compound), 0);
        }
        String trimmed = compound.trim();
        int end = scanCompound(trimmed, 0);
        if (end != trimmed.length()) {
            throw new SelectorSyntaxException("Unexpected character '" + trimmed.charAt(end) + "'", trimmed, end);
        }
        return parseCompound(trimmed, 0, end);
    }

    private CompoundSelector parseCompound(String source, int start, int end) {
        CompoundSelector compound = CompoundSelector.empty();
        int i = start;
        while (i < end) {
            char c = source.charAt(i);
            switch (c) {
                case '.' -> {
                    int nameEnd = scanIdentifier(source, i + 1, end);
                    compound.add(SimpleSelector.className(source.substring(i + 1, nameEnd)));
                    i = nameEnd;
                }
                case '#' -> {
                    int nameEnd = scanIdentifier(source, i + 1, end);
                    compound.add(SimpleSelector.id(source.substring(i + 1, nameEnd)));
                    i = nameEnd;
                }
                case '%' -> {
                    int nameEnd = scanIdentifier(source, i + 1, end);
                    compound.add(SimpleSelector.placeholder(source.substring(i + 1, nameEnd)));
                    i = nameEnd;
                }
                case '[' -> {
                    int close = findClosing(source, i, '[', ']');
                    if (close == -1 || close >= end) {
                        throw new SelectorSyntaxException("Unclosed attribute selector", source, i);
                    }
                    compound.add(SimpleSelector.attribute(source.substring(i + 1, close).trim()));
                    i = close + 1;
                }
                case ':' -> {
                    boolean element = i + 1 < end && source.charAt(i + 1) == ':';
                    int nameStart = element ? i + 2 : i + 1;
                    int nameEnd = scanIdentifier(source, nameStart, end);
                    if (nameEnd < end && source.charAt(nameEnd) == '(') {
                        int close = findClosing(source, nameEnd, '(', ')');
                        if (close == -1 || close >= end) {
                            throw new SelectorSyntaxException("Unclosed pseudo selector argument", source, nameEnd);
                        }
                        nameEnd = close + 1;
                    }
                    String name = source.substring(nameStart, nameEnd);
                    compound.add(element ? SimpleSelector.pseudoElement(name) : SimpleSelector.pseudoClass(name));
                    i = nameEnd;
                }
                case '*' -> {
                    compound.add(SimpleSelector.universal());
                    i++;
                }
                case '&' -> {
                    compound.add(SimpleSelector.parent());
                    i++;
                }
                default -> {
                    if (!isIdentifierChar(c) || !compound.isEmpty()) {
                        throw new SelectorSyntaxException("Unexpected character '" + c + "'", source, i);
                    }
                    int nameEnd = scanIdentifier(source, i, end);
                    compound.add(SimpleSelector.type(source.substring(i, nameEnd)));
                    i = nameEnd;
                }
            }
        }
        return compound;
    }

    private int scanIdentifier(String source, int start, int end) {
        int i = start;
        while (i < end && isIdentifierChar(source.charAt(i))) {
            i++;
        }
        if (i == start) {
            throw new SelectorSyntaxException("Expected a name", source, start);
        }
        return i;
    }

    /**
     * Returns the index just past the compound selector starting at {@code start}.
     */
    private int scanCompound(String source, int start) {
        int i = start;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c) || isCombinatorChar(c) || c == ',') {
                break;
            }
            if (c == '[' || c == '(') {
                int close = findClosing(source, i, c, c == '[' ? ']' : ')');
                if (close == -1) {
                    throw new SelectorSyntaxException("Unbalanced '" + c + "'", source, i);
                }
                i = close + 1;
                continue;
            }
            i++;
        }
        return i;
    }

    /**
     * Find the index of the bracket closing the one at {@code open}, skipping quoted strings.
     */
    private int findClosing(String source, int open, char opening, char closing) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == opening) {
                depth++;
            } else if (c == closing) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Find the index of {@code target} that's not inside brackets, parentheses or quotes
     */
    private int findTopLevel(String source, char target, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isCombinatorChar(char c) {
        return c == '>' || c == '+' || c == '~';
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c > 0x7F;
    }
}
