// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.ArrayList;
import java.util.List;

/// Splits a chunk into tokens, dropping whitespace and comments.
final class ChunkLexer {

  enum TokenType {NAME, NUMBER, STRING, SYMBOL, EOF}

  /// @param number the parsed value of a NUMBER token, zero otherwise
  record Token(TokenType type, String text, double number, int line) {
    boolean is(String symbolOrKeyword) {
      return (type == TokenType.SYMBOL || type == TokenType.NAME) && text.equals(symbolOrKeyword);
    }
  }

  private static final String SYMBOLS = "=,;.[]{}()-/";

  private final String source;
  private int pos;
  private int line = 1;

  ChunkLexer(String source) {
    this.source = source;
  }

  List<Token> tokens() {
    final var tokens = new ArrayList<Token>();
    while (true) {
      skipBlankAndComments();
      if (pos >= source.length()) {
        tokens.add(new Token(TokenType.EOF, "<eof>", 0, line));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private Token next() {
    final char c = source.charAt(pos);
    if (Character.isLetter(c) && c < 0x80 || c == '_') {
      final int start = pos;
      while (pos < source.length() && isNameChar(source.charAt(pos))) {
        pos++;
      }
      return new Token(TokenType.NAME, source.substring(start, pos), 0, line);
    }
    if (isDigit(c) || c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1))) {
      return number();
    }
    if (c == '"' || c == '\'') {
      return quotedString(c);
    }
    if (c == '[' && longBracketLevel() >= 0) {
      final int startLine = line;
      return new Token(TokenType.STRING, longBracket("string"), 0, startLine);
    }
    if (SYMBOLS.indexOf(c) >= 0) {
      pos++;
      return new Token(TokenType.SYMBOL, String.valueOf(c), 0, line);
    }
    throw new ChunkSyntaxException(line, "unexpected symbol near '" + c + "'");
  }

  private void skipBlankAndComments() {
    while (pos < source.length()) {
      final char c = source.charAt(pos);
      if (c == '\n') {
        line++;
        pos++;
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else if (source.startsWith("--", pos)) {
        pos += 2;
        if (pos < source.length() && source.charAt(pos) == '[' && longBracketLevel() >= 0) {
          longBracket("comment");
        } else {
          while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
          }
        }
      } else {
        return;
      }
    }
  }

  /// Level of a long bracket opening at `pos` (`[[` is 0, `[=[` is 1), or -1 if there is none.
  private int longBracketLevel() {
    int p = pos + 1;
    int level = 0;
    while (p < source.length() && source.charAt(p) == '=') {
      level++;
      p++;
    }
    return p < source.length() && source.charAt(p) == '[' ? level : -1;
  }

  private String longBracket(String what) {
    final int level = longBracketLevel();
    final int startLine = line;
    pos += level + 2;
    // a newline straight after the opening bracket is not part of the text
    if (pos < source.length() && source.charAt(pos) == '\n') {
      line++;
      pos++;
    }
    final String close = "]" + "=".repeat(level) + "]";
    final int end = source.indexOf(close, pos);
    if (end < 0) {
      throw new ChunkSyntaxException(startLine, "unfinished long " + what);
    }
    final String text = source.substring(pos, end);
    line += (int) text.chars().filter(ch -> ch == '\n').count();
    pos = end + close.length();
    return text;
  }

  private Token number() {
    final int start = pos;
    double value;
    if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
      pos += 2;
      while (pos < source.length() && Character.digit(source.charAt(pos), 16) >= 0) {
        pos++;
      }
      rejectTrailingNameChars(start);
      try {
        value = Long.parseLong(source.substring(start + 2, pos), 16);
      } catch (NumberFormatException e) {
        throw new ChunkSyntaxException(line, "malformed number near '" + source.substring(start, pos) + "'");
      }
    } else {
      while (pos < source.length() && (isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
        pos++;
      }
      if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
        pos++;
        if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
          pos++;
        }
        while (pos < source.length() && isDigit(source.charAt(pos))) {
          pos++;
        }
      }
      rejectTrailingNameChars(start);
      try {
        value = Double.parseDouble(source.substring(start, pos));
      } catch (NumberFormatException e) {
        throw new ChunkSyntaxException(line, "malformed number near '" + source.substring(start, pos) + "'");
      }
    }
    return new Token(TokenType.NUMBER, source.substring(start, pos), value, line);
  }

  private void rejectTrailingNameChars(int start) {
    if (pos < source.length() && isNameChar(source.charAt(pos))) {
      while (pos < source.length() && isNameChar(source.charAt(pos))) {
        pos++;
      }
      throw new ChunkSyntaxException(line, "malformed number near '" + source.substring(start, pos) + "'");
    }
  }

  private Token quotedString(char quote) {
    final int startLine = line;
    final var sb = new StringBuilder();
    pos++;
    while (true) {
      if (pos >= source.length()) {
        throw new ChunkSyntaxException(startLine, "unfinished string");
      }
      final char c = source.charAt(pos++);
      if (c == quote) {
        return new Token(TokenType.STRING, sb.toString(), 0, startLine);
      } else if (c == '\n') {
        throw new ChunkSyntaxException(line, "unfinished string");
      } else if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (pos >= source.length()) {
        throw new ChunkSyntaxException(startLine, "unfinished string");
      }
      final char e = source.charAt(pos++);
      switch (e) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case 'a' -> sb.append('\u0007');
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'v' -> sb.append('\u000b');
        case '\\', '"', '\'' -> sb.append(e);
        case '\n' -> {
          line++;
          sb.append('\n');
        }
        default -> {
          if (!isDigit(e)) {
            throw new ChunkSyntaxException(line, "invalid escape sequence '\\" + e + "'");
          }
          int code = e - '0';
          for (int i = 0; i < 2 && pos < source.length() && isDigit(source.charAt(pos)); i++) {
            code = code * 10 + (source.charAt(pos++) - '0');
          }
          if (code > 255) {
            throw new ChunkSyntaxException(line, "escape sequence too large");
          }
          sb.append((char) code);
        }
      }
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isNameChar(char c) {
    return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || isDigit(c) || c == '_';
  }
}
