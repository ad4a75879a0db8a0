package com.raditha.cppnorm.lexer;

import com.raditha.cppnorm.diagnostics.SimplifyException;
import com.raditha.cppnorm.model.SourceLocation;
import com.raditha.cppnorm.model.TokenList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Splits preprocessed C or C++ source text into a {@link TokenList}.
 * <p>
 * Comments are dropped. Lines starting with {@code #} (line markers and any directive
 * that survived preprocessing) are skipped together with their continuation lines.
 * Operators are matched longest first; a {@code >>} is always one token here and is
 * split later by the template linker when it closes two template argument lists.
 */
public class CppLexer {

    private static final Logger logger = LoggerFactory.getLogger(CppLexer.class);

    /** Multi-character punctuators, longest first. */
    private static final List<String> OPERATORS = List.of(
            "<<=", ">>=", "...", "->*", "<=>",
            "::", "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", ".*", "##");

    private final boolean cpp;

    public CppLexer(boolean cpp) {
        this.cpp = cpp;
    }

    /**
     * Tokenize {@code source} into a new token list.
     *
     * @param source   preprocessed source text
     * @param fileName name recorded in the file table for token locations
     * @throws SimplifyException for an unterminated comment, string or character literal
     */
    public TokenList tokenize(String source, String fileName) {
        TokenList list = new TokenList(cpp);
        tokenize(list, source, fileName);
        return list;
    }

    /**
     * Append the tokens of {@code source} to an existing list.
     */
    public void tokenize(TokenList list, String source, String fileName) {
        int fileIndex = list.addFile(fileName);
        int before = list.size();
        new Scan(list, source, fileName, fileIndex).run();
        logger.debug("Tokenized {}: {} tokens", fileName, list.size() - before);
    }

    /**
     * Cursor over one source text.
     */
    private final class Scan {
        private final TokenList list;
        private final String src;
        private final String fileName;
        private final int fileIndex;
        private int pos;
        private int line = 1;
        private int lineStart;
        private boolean atLineStart = true;

        Scan(TokenList list, String src, String fileName, int fileIndex) {
            this.list = list;
            this.src = src;
            this.fileName = fileName;
            this.fileIndex = fileIndex;
        }

        void run() {
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '\n') {
                    newLine(pos + 1);
                    pos++;
                    atLineStart = true;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '\\' && peek(1) == '\n') {
                    pos++;
                } else if (c == '/' && peek(1) == '/') {
                    skipLineComment();
                } else if (c == '/' && peek(1) == '*') {
                    skipBlockComment();
                } else if (c == '#' && atLineStart) {
                    skipDirective();
                } else {
                    atLineStart = false;
                    scanToken(c);
                }
            }
        }

        private void scanToken(char c) {
            int start = pos;
            int column = pos - lineStart + 1;
            int startLine = line;
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                scanNumber();
            } else if (isIdentifierStart(c)) {
                scanIdentifier();
                if (pos < src.length() && isLiteralPrefix(src.substring(start, pos))
                        && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')) {
                    if (src.charAt(pos) == '"' && src.substring(start, pos).endsWith("R")) {
                        scanRawString(start);
                    } else {
                        scanQuoted(src.charAt(pos));
                    }
                }
            } else if (c == '"' || c == '\'') {
                scanQuoted(c);
            } else {
                scanOperator();
            }
            list.append(src.substring(start, pos), fileIndex, startLine, column);
        }

        private void scanNumber() {
            pos++;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                char prev = src.charAt(pos - 1);
                if (Character.isLetterOrDigit(c) || c == '.' || c == '_') {
                    pos++;
                } else if ((c == '+' || c == '-') && "eEpP".indexOf(prev) >= 0 && !isHexDigitE(prev)) {
                    pos++;
                } else if (c == '\'' && cpp && Character.isLetterOrDigit(peek(1))) {
                    pos++;
                } else {
                    return;
                }
            }
        }

        /** In a hex literal such as 0x1e+1 the e is a digit, not an exponent. */
        private boolean isHexDigitE(char prev) {
            if (prev != 'e' && prev != 'E') {
                return false;
            }
            int i = pos - 1;
            while (i > 0 && (Character.isLetterOrDigit(src.charAt(i - 1)) || src.charAt(i - 1) == '.')) {
                i--;
            }
            return src.startsWith("0x", i) || src.startsWith("0X", i);
        }

        private void scanIdentifier() {
            pos++;
            while (pos < src.length() && isIdentifierPart(src.charAt(pos))) {
                pos++;
            }
        }

        private void scanQuoted(char quote) {
            int startLine = line;
            int startColumn = pos - lineStart + 1;
            pos++;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '\\' && pos + 1 < src.length()) {
                    if (src.charAt(pos + 1) == '\n') {
                        newLine(pos + 2);
                    }
                    pos += 2;
                } else if (c == quote) {
                    pos++;
                    return;
                } else if (c == '\n') {
                    break;
                } else {
                    pos++;
                }
            }
            String what = quote == '"' ? "string literal" : "character literal";
            throw new SimplifyException(SimplifyException.Kind.SYNTAX,
                    new SourceLocation(fileName, startLine, startColumn), "Unterminated " + what + ".");
        }

        private void scanRawString(int tokenStart) {
            int startLine = line;
            int startColumn = tokenStart - lineStart + 1;
            int open = src.indexOf('(', pos);
            if (open < 0) {
                throw new SimplifyException(SimplifyException.Kind.SYNTAX,
                        new SourceLocation(fileName, startLine, startColumn), "Invalid raw string literal.");
            }
            String delimiter = src.substring(pos + 1, open);
            String terminator = ")" + delimiter + "\"";
            int close = src.indexOf(terminator, open + 1);
            if (close < 0) {
                throw new SimplifyException(SimplifyException.Kind.SYNTAX,
                        new SourceLocation(fileName, startLine, startColumn), "Unterminated raw string literal.");
            }
            for (int i = pos; i < close; i++) {
                if (src.charAt(i) == '\n') {
                    newLine(i + 1);
                }
            }
            pos = close + terminator.length();
        }

        private void scanOperator() {
            for (String op : OPERATORS) {
                if (src.startsWith(op, pos)) {
                    pos += op.length();
                    return;
                }
            }
            pos++;
        }

        private void skipLineComment() {
            while (pos < src.length() && src.charAt(pos) != '\n') {
                if (src.charAt(pos) == '\\' && peek(1) == '\n') {
                    newLine(pos + 2);
                    pos++;
                }
                pos++;
            }
        }

        private void skipBlockComment() {
            int startLine = line;
            int startColumn = pos - lineStart + 1;
            int end = src.indexOf("*/", pos + 2);
            if (end < 0) {
                throw new SimplifyException(SimplifyException.Kind.SYNTAX,
                        new SourceLocation(fileName, startLine, startColumn), "Unterminated comment.");
            }
            for (int i = pos; i < end; i++) {
                if (src.charAt(i) == '\n') {
                    newLine(i + 1);
                }
            }
            pos = end + 2;
        }

        private void skipDirective() {
            while (pos < src.length() && src.charAt(pos) != '\n') {
                if (src.charAt(pos) == '\\' && peek(1) == '\n') {
                    newLine(pos + 2);
                    pos++;
                }
                pos++;
            }
        }

        private void newLine(int nextLineStart) {
            line++;
            lineStart = nextLineStart;
        }

        private char peek(int offset) {
            int i = pos + offset;
            return i < src.length() ? src.charAt(i) : '\0';
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isLiteralPrefix(String text) {
        return switch (text) {
            case "L", "u", "U", "u8", "R", "LR", "uR", "UR", "u8R" -> true;
            default -> false;
        };
    }
}
