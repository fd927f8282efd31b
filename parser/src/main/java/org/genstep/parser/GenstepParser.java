// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.genstep.grammar.GenscriptBaseVisitor;
import org.genstep.grammar.GenscriptLexer;
import org.genstep.grammar.GenscriptParser;

/** Parses Genstep source into a JSON AST that the interpreter's tree parser consumes. */
public class GenstepParser {
  public record ParserOutput(
      String source, GenscriptParser parser, ParseTree parseTree, JsonElement jsonAst) {}

  public static JsonElement parse(String filename, String genstepCode) {
    return parseTrees(filename, genstepCode).jsonAst();
  }

  public static ParserOutput parseTrees(String filename, String genstepCode) {
    CharStream input = CharStreams.fromString(genstepCode);
    GenscriptLexer lexer = new GenscriptLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(new GenstepErrorListener(filename, genstepCode));

    CommonTokenStream tokens = new CommonTokenStream(lexer);
    GenscriptParser parser = new GenscriptParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(new GenstepErrorListener(filename, genstepCode));

    ParseTree parseTree = parser.file_input();
    var ast = new GenscriptJsonVisitor().visit(parseTree);
    return new ParserOutput(genstepCode, parser, parseTree, ast);
  }
}

class GenscriptJsonVisitor extends GenscriptBaseVisitor<JsonElement> {

  @Override
  public JsonElement visitFile_input(GenscriptParser.File_inputContext ctx) {
    var node = createNode(ctx, "Module");
    var body = new JsonArray();
    for (var definition : ctx.definition()) {
      body.add(visitDefinition(definition));
    }
    node.add("body", body);
    return node;
  }

  @Override
  public JsonElement visitDefinition(GenscriptParser.DefinitionContext ctx) {
    var node = createNode(ctx, "GeneratorDef");
    node.addProperty("name", ctx.name.getText());
    var params = new JsonArray();
    if (ctx.parameters() != null) {
      for (var name : ctx.parameters().NAME()) {
        params.add(name.getText());
      }
    }
    node.add("params", params);
    node.add("body", visitBlock(ctx.block()));
    return node;
  }

  @Override
  public JsonElement visitBlock(GenscriptParser.BlockContext ctx) {
    var node = createNode(ctx, "Block");
    var body = new JsonArray();
    for (var statement : ctx.statement()) {
      body.add(visitStatement(statement));
    }
    node.add("body", body);
    return node;
  }

  @Override
  public JsonElement visitStatement(GenscriptParser.StatementContext ctx) {
    if (ctx.if_stmt() != null) {
      return visitIf_stmt(ctx.if_stmt());
    }
    if (ctx.while_stmt() != null) {
      return visitWhile_stmt(ctx.while_stmt());
    }
    if (ctx.let_stmt() != null) {
      return visitLet_stmt(ctx.let_stmt());
    }
    if (ctx.try_stmt() != null) {
      return visitTry_stmt(ctx.try_stmt());
    }
    if (ctx.block() != null) {
      return visitBlock(ctx.block());
    }
    return visit(ctx.expression());
  }

  @Override
  public JsonElement visitIf_stmt(GenscriptParser.If_stmtContext ctx) {
    var node = createNode(ctx, "If");
    node.add("test", visit(ctx.expression()));
    node.add("body", visitBlock(ctx.block(0)));
    if (ctx.if_stmt() != null) {
      node.add("orelse", visitIf_stmt(ctx.if_stmt()));
    } else if (ctx.block().size() > 1) {
      node.add("orelse", visitBlock(ctx.block(1)));
    } else {
      node.add("orelse", JsonNull.INSTANCE);
    }
    return node;
  }

  @Override
  public JsonElement visitWhile_stmt(GenscriptParser.While_stmtContext ctx) {
    var node = createNode(ctx, "While");
    node.add("test", visit(ctx.expression()));
    node.add("body", visitBlock(ctx.block()));
    return node;
  }

  @Override
  public JsonElement visitLet_stmt(GenscriptParser.Let_stmtContext ctx) {
    var node = createNode(ctx, "Let");
    node.addProperty(
        "mode", ctx.kind.getType() == GenscriptParser.BIND ? "simultaneous" : "sequential");
    var bindings = new JsonArray();
    for (var binding : ctx.binding()) {
      var bindingNode = createNode(binding);
      bindingNode.addProperty("name", binding.NAME().getText());
      bindingNode.add("value", visit(binding.expression()));
      bindings.add(bindingNode);
    }
    node.add("bindings", bindings);
    node.add("body", visitBlock(ctx.block()));
    return node;
  }

  @Override
  public JsonElement visitTry_stmt(GenscriptParser.Try_stmtContext ctx) {
    var node = createNode(ctx, "Try");
    node.add("body", visitBlock(ctx.block()));
    var handlers = new JsonArray();
    for (var catchBlock : ctx.catch_block()) {
      var handler = createNode(catchBlock);
      handler.addProperty("pattern", catchBlock.pattern.getText());
      handler.addProperty(
          "name", catchBlock.variable == null ? null : catchBlock.variable.getText());
      handler.add("body", visitBlock(catchBlock.block()));
      handlers.add(handler);
    }
    node.add("handlers", handlers);
    return node;
  }

  @Override
  public JsonElement visitDelegateExpr(GenscriptParser.DelegateExprContext ctx) {
    var node = createNode(ctx, "YieldFrom");
    node.add("value", visit(ctx.expression()));
    return node;
  }

  @Override
  public JsonElement visitYieldExpr(GenscriptParser.YieldExprContext ctx) {
    var node = createNode(ctx, "Yield");
    node.add("value", ctx.expression() == null ? JsonNull.INSTANCE : visit(ctx.expression()));
    node.addProperty("tag", ctx.tag == null ? null : ctx.tag.getText());
    return node;
  }

  @Override
  public JsonElement visitAssignExpr(GenscriptParser.AssignExprContext ctx) {
    var node = createNode(ctx, "Assign");
    node.add("target", visit(ctx.target));
    node.add("value", visit(ctx.value));
    return node;
  }

  @Override
  public JsonElement visitPlainExpr(GenscriptParser.PlainExprContext ctx) {
    return visit(ctx.operation());
  }

  @Override
  public JsonElement visitUnaryOp(GenscriptParser.UnaryOpContext ctx) {
    String function = ctx.op.getText().equals("!") ? "not" : "neg";
    return createCall(ctx, function, visit(ctx.operation()));
  }

  @Override
  public JsonElement visitBinaryOp(GenscriptParser.BinaryOpContext ctx) {
    return createCall(ctx, ctx.op.getText(), visit(ctx.operation(0)), visit(ctx.operation(1)));
  }

  @Override
  public JsonElement visitAndOp(GenscriptParser.AndOpContext ctx) {
    // a && b evaluates b only when a is truthy.
    var node = createNode(ctx, "If");
    node.add("test", visit(ctx.operation(0)));
    node.add("body", visit(ctx.operation(1)));
    node.add("orelse", createConstantNode(ctx, false));
    return node;
  }

  @Override
  public JsonElement visitOrOp(GenscriptParser.OrOpContext ctx) {
    // a || b evaluates b only when a is falsy.
    var node = createNode(ctx, "If");
    node.add("test", visit(ctx.operation(0)));
    node.add("body", createConstantNode(ctx, true));
    node.add("orelse", visit(ctx.operation(1)));
    return node;
  }

  @Override
  public JsonElement visitPrimaryOp(GenscriptParser.PrimaryOpContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public JsonElement visitCallExpr(GenscriptParser.CallExprContext ctx) {
    var node = createNode(ctx, "Call");
    node.add("func", createNameNode(ctx, ctx.NAME().getText()));
    var args = new JsonArray();
    if (ctx.arguments() != null) {
      for (var arg : ctx.arguments().expression()) {
        args.add(visit(arg));
      }
    }
    node.add("args", args);
    return node;
  }

  @Override
  public JsonElement visitNameExpr(GenscriptParser.NameExprContext ctx) {
    return createNameNode(ctx, ctx.NAME().getText());
  }

  @Override
  public JsonElement visitLiteralExpr(GenscriptParser.LiteralExprContext ctx) {
    return visitLiteral(ctx.literal());
  }

  @Override
  public JsonElement visitQuoteExpr(GenscriptParser.QuoteExprContext ctx) {
    var node = createNode(ctx, "Quote");
    node.add("datum", visitDatum(ctx.datum()));
    return node;
  }

  @Override
  public JsonElement visitParenExpr(GenscriptParser.ParenExprContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public JsonElement visitDatum(GenscriptParser.DatumContext ctx) {
    if (ctx.NAME() != null) {
      var symbol = createNode(ctx, "Symbol");
      symbol.addProperty("id", ctx.NAME().getText());
      return symbol;
    }
    if (ctx.literal() != null) {
      return visitLiteral(ctx.literal());
    }
    var list = createNode(ctx, "List");
    var elts = new JsonArray();
    for (var element : ctx.datum()) {
      elts.add(visitDatum(element));
    }
    list.add("elts", elts);
    return list;
  }

  @Override
  public JsonElement visitLiteral(GenscriptParser.LiteralContext ctx) {
    var constant = createNode(ctx, "Constant");
    if (ctx.INT() != null) {
      constant.addProperty("value", NumberParser.parseAsLong(ctx.INT().getText()));
      constant.addProperty("typename", "int");
    } else if (ctx.FLOAT() != null) {
      String numberText = ctx.FLOAT().getText();
      if (NumberParser.getFormat(numberText) != NumberParser.Format.FLOAT) {
        throw new NumberFormatException("Unable to parse numeric literal: " + numberText);
      }
      constant.addProperty("value", Double.parseDouble(numberText.replace("_", "")));
      constant.addProperty("typename", "float");
    } else if (ctx.STRING() != null) {
      constant.addProperty("value", unescape(ctx.STRING().getText()));
      constant.addProperty("typename", "str");
    } else if (ctx.TRUE() != null || ctx.FALSE() != null) {
      constant.addProperty("value", ctx.TRUE() != null);
      constant.addProperty("typename", "bool");
    } else {
      constant.add("value", JsonNull.INSTANCE);
      constant.addProperty("typename", "null");
    }
    return constant;
  }

  private static String unescape(String quoted) {
    var out = new StringBuilder();
    String body = quoted.substring(1, quoted.length() - 1);
    for (int i = 0; i < body.length(); ++i) {
      char c = body.charAt(i);
      if (c != '\\' || i + 1 == body.length()) {
        out.append(c);
        continue;
      }
      char escaped = body.charAt(++i);
      switch (escaped) {
        case 'n' -> out.append('\n');
        case 't' -> out.append('\t');
        case 'r' -> out.append('\r');
        case '0' -> out.append('\0');
        default -> out.append(escaped);
      }
    }
    return out.toString();
  }

  private JsonObject createCall(ParserRuleContext ctx, String function, JsonElement... args) {
    var node = createNode(ctx, "Call");
    node.add("func", createNameNode(ctx, function));
    var argsArray = new JsonArray();
    for (var arg : args) {
      argsArray.add(arg);
    }
    node.add("args", argsArray);
    return node;
  }

  private JsonObject createNameNode(ParserRuleContext ctx, String id) {
    var name = createNode(ctx, "Name");
    name.addProperty("id", id);
    return name;
  }

  private JsonObject createConstantNode(ParserRuleContext ctx, boolean value) {
    var constant = createNode(ctx, "Constant");
    constant.addProperty("value", value);
    constant.addProperty("typename", "bool");
    return constant;
  }

  private JsonObject createNode(ParserRuleContext ctx, String type) {
    var node = new JsonObject();
    node.addProperty("type", type);
    node.addProperty("lineno", ctx.start.getLine());
    return node;
  }

  private JsonObject createNode(ParserRuleContext ctx) {
    var node = new JsonObject();
    node.addProperty("lineno", ctx.start.getLine());
    return node;
  }
}
