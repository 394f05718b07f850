// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import io.github.simbo1905.persistence.ChunkLexer.Token;
import io.github.simbo1905.persistence.ChunkLexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import static io.github.simbo1905.persistence.Persistence.LOGGER;

/// Recursive descent parser producing [ChunkAst] statements. It enforces the two ceilings that
/// matter for persisted chunks: the number of constants (numerals, strings and field names) one
/// function body may hold, and how deeply constructors, parentheses and blocks may nest.
final class ChunkParser {
  private final List<Token> tokens;
  private final int constantCeiling;
  private final int nestingLimit;
  /// constants seen so far in each enclosing function body, innermost on top
  private final ArrayDeque<int[]> constants = new ArrayDeque<>();
  private int index;
  private int depth;

  ChunkParser(List<Token> tokens, int constantCeiling, int nestingLimit) {
    this.tokens = tokens;
    this.constantCeiling = constantCeiling;
    this.nestingLimit = nestingLimit;
  }

  List<ChunkAst.Stat> chunk() {
    constants.push(new int[1]);
    final var body = block();
    if (peek().type() != TokenType.EOF) {
      throw error("'<eof>' expected near '" + peek().text() + "'");
    }
    final int mainConstants = constants.pop()[0];
    LOGGER.finer(() -> "Parsed chunk: statements=" + body.size() + " mainConstants=" + mainConstants);
    return body;
  }

  private List<ChunkAst.Stat> block() {
    enter();
    final var statements = new ArrayList<ChunkAst.Stat>();
    while (peek().type() != TokenType.EOF && !peek().is("end")) {
      statements.add(statement());
      if (peek().is(";")) {
        advance();
      }
    }
    leave();
    return statements;
  }

  private ChunkAst.Stat statement() {
    final Token first = peek();
    if (first.is("local")) {
      advance();
      final String name = expectName();
      expect("=");
      return new ChunkAst.Local(first.line(), name, expression());
    }
    if (first.is("for")) {
      advance();
      final String variable = expectName();
      expect("=");
      final var start = expression();
      expect(",");
      final var limit = expression();
      expect("do");
      final var body = block();
      expect("end");
      return new ChunkAst.NumericFor(first.line(), variable, start, limit, body);
    }
    if (first.is("(")) {
      return invokedFunction();
    }
    if (first.type() == TokenType.NAME && !Literals.KEYWORDS.contains(first.text())) {
      final var target = suffixed(new ChunkAst.Name(expectName()));
      if (!peek().is("=")) {
        throw error("'=' expected near '" + peek().text() + "'");
      }
      advance();
      return new ChunkAst.Assign(first.line(), target, expression());
    }
    throw error("unexpected symbol near '" + first.text() + "'");
  }

  /// `(function () body end)()`, the only call form persisted chunks use.
  private ChunkAst.Stat invokedFunction() {
    final int line = expect("(").line();
    enter();
    expect("function");
    expect("(");
    expect(")");
    constants.push(new int[1]);
    final var body = block();
    constants.pop();
    expect("end");
    expect(")");
    leave();
    expect("(");
    expect(")");
    return new ChunkAst.InvokeBlock(line, body);
  }

  private ChunkAst.Expr suffixed(ChunkAst.Expr prefix) {
    var expr = prefix;
    while (true) {
      if (peek().is("[")) {
        advance();
        final var key = expression();
        expect("]");
        expr = new ChunkAst.Index(expr, key);
      } else if (peek().is(".")) {
        advance();
        final String field = expectName();
        countConstant();
        expr = new ChunkAst.Index(expr, new ChunkAst.StringLiteral(field));
      } else {
        return expr;
      }
    }
  }

  private ChunkAst.Expr expression() {
    var expr = unary();
    while (peek().is("/")) {
      advance();
      expr = new ChunkAst.Divide(expr, unary());
    }
    return expr;
  }

  private ChunkAst.Expr unary() {
    if (peek().is("-")) {
      advance();
      enter();
      final var operand = unary();
      leave();
      return new ChunkAst.Negate(operand);
    }
    return simple();
  }

  private ChunkAst.Expr simple() {
    final Token token = peek();
    switch (token.type()) {
      case NUMBER -> {
        advance();
        countConstant();
        return new ChunkAst.NumberLiteral(token.number());
      }
      case STRING -> {
        advance();
        countConstant();
        return new ChunkAst.StringLiteral(token.text());
      }
      case NAME -> {
        advance();
        switch (token.text()) {
          case "nil" -> {
            return new ChunkAst.NilLiteral();
          }
          case "true" -> {
            return new ChunkAst.BoolLiteral(true);
          }
          case "false" -> {
            return new ChunkAst.BoolLiteral(false);
          }
          default -> {
            if (Literals.KEYWORDS.contains(token.text())) {
              throw error("unexpected symbol near '" + token.text() + "'");
            }
            return suffixed(new ChunkAst.Name(token.text()));
          }
        }
      }
      case SYMBOL -> {
        if (token.is("{")) {
          return constructor();
        }
        if (token.is("(")) {
          advance();
          enter();
          final var inner = expression();
          expect(")");
          leave();
          return inner;
        }
        throw error("unexpected symbol near '" + token.text() + "'");
      }
      default -> throw error("unexpected symbol near '" + token.text() + "'");
    }
  }

  private ChunkAst.Expr constructor() {
    expect("{");
    enter();
    final var fields = new ArrayList<ChunkAst.Field>();
    while (!peek().is("}")) {
      if (peek().is("[")) {
        advance();
        final var key = expression();
        expect("]");
        expect("=");
        fields.add(new ChunkAst.Keyed(key, expression()));
      } else if (peek().type() == TokenType.NAME && lookahead(1).is("=")
          && !Literals.KEYWORDS.contains(peek().text())) {
        final var key = new ChunkAst.StringLiteral(expectName());
        countConstant();
        expect("=");
        fields.add(new ChunkAst.Keyed(key, expression()));
      } else {
        fields.add(new ChunkAst.Positional(expression()));
      }
      if (peek().is(",") || peek().is(";")) {
        advance();
      } else if (!peek().is("}")) {
        throw error("'}' expected near '" + peek().text() + "'");
      }
    }
    advance();
    leave();
    return new ChunkAst.Constructor(fields);
  }

  private void countConstant() {
    final int[] count = constants.peek();
    assert count != null : "constant outside of any function body";
    if (++count[0] > constantCeiling) {
      throw error("constant table overflow (more than " + constantCeiling + " constants in one function)");
    }
  }

  private void enter() {
    if (++depth > nestingLimit) {
      throw error("chunk has too many syntax levels (limit is " + nestingLimit + ")");
    }
  }

  private void leave() {
    depth--;
  }

  private Token peek() {
    return tokens.get(index);
  }

  private Token lookahead(int n) {
    return tokens.get(Math.min(index + n, tokens.size() - 1));
  }

  private Token advance() {
    final Token token = tokens.get(index);
    if (token.type() != TokenType.EOF) {
      index++;
    }
    return token;
  }

  private Token expect(String symbolOrKeyword) {
    if (!peek().is(symbolOrKeyword)) {
      throw error("'" + symbolOrKeyword + "' expected near '" + peek().text() + "'");
    }
    return advance();
  }

  private String expectName() {
    final Token token = peek();
    if (token.type() != TokenType.NAME || Literals.KEYWORDS.contains(token.text())) {
      throw error("<name> expected near '" + token.text() + "'");
    }
    advance();
    return token.text();
  }

  private ChunkSyntaxException error(String message) {
    return new ChunkSyntaxException(peek().line(), message);
  }
}
