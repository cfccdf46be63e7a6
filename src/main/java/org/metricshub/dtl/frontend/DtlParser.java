package org.metricshub.dtl.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DTL Compiler
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.dtl.frontend.ast.AggregateFunction;
import org.metricshub.dtl.frontend.ast.CleanAst;
import org.metricshub.dtl.frontend.ast.CommandAst;
import org.metricshub.dtl.frontend.ast.ComparisonOperator;
import org.metricshub.dtl.frontend.ast.FilterAst;
import org.metricshub.dtl.frontend.ast.GroupByAst;
import org.metricshub.dtl.frontend.ast.Literal;
import org.metricshub.dtl.frontend.ast.LoadAst;
import org.metricshub.dtl.frontend.ast.MissingStrategy;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.frontend.ast.RenameAst;
import org.metricshub.dtl.frontend.ast.SaveAst;
import org.metricshub.dtl.frontend.ast.SelectAst;
import org.metricshub.dtl.frontend.ast.SkipAst;
import org.metricshub.dtl.frontend.ast.SortAst;
import org.metricshub.dtl.frontend.ast.SortOrder;
import org.metricshub.dtl.frontend.ast.TrimAst;
import org.metricshub.dtl.util.DtlLogger;
import org.metricshub.dtl.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts the tokens of a DTL script into a {@link Program}.
 * <p>
 * Each command has a fixed grammar and its own production, selected by the
 * command keyword that starts it. A production consumes exactly the tokens
 * of its command. There is no error recovery: the first mismatch raises a
 * {@link ParserException}.
 * <p>
 * A parser instance holds the state of one parse and must not be shared.
 */
public class DtlParser {

	private static final Logger LOG = DtlLogger.getLogger(DtlParser.class);

	private final String sourceDescription;

	private List<Token> tokens;
	private int current;
	private Token token;

	/**
	 * <p>
	 * Constructor for DtlParser.
	 * </p>
	 *
	 * @param sourceDescription description of the script, used in error messages
	 */
	public DtlParser(String sourceDescription) {
		this.sourceDescription = sourceDescription == null ? ScriptSource.DESCRIPTION_INLINE_SCRIPT : sourceDescription;
	}

	/**
	 * Parse the token list produced by {@link DtlLexer}.
	 *
	 * @param localTokens tokens terminated by {@link TokenType#EOF}
	 * @return the program, commands in source order
	 * @throws ParserException on the first token that does not fit the grammar
	 */
	public Program parse(List<Token> localTokens) {
		if (localTokens == null || localTokens.isEmpty() || localTokens.get(localTokens.size() - 1).getType() != TokenType.EOF) {
			throw new IllegalArgumentException("Token list must end with " + TokenType.EOF);
		}
		this.tokens = localTokens;
		current = 0;
		token = tokens.get(0);
		Program program = PROGRAM();
		LOG.debug("{}: {} commands", sourceDescription, program.size());
		return program;
	}

	private Token lexer() {
		Token consumed = token;
		if (current < tokens.size() - 1) {
			current++;
		}
		token = tokens.get(current);
		return consumed;
	}

	private Token lexer(TokenType expectedToken, String expected) {
		if (token.getType() != expectedToken) {
			throw parserException("Expecting " + expected + ". Found: " + describe(token));
		}
		return lexer();
	}

	private static String describe(Token t) {
		return t.getType() == TokenType.EOF ? "EOF" : t.getType().name() + " (" + t.getText() + ")";
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : { COMMAND } EOF
	Program PROGRAM() {
		List<CommandAst> commands = new ArrayList<CommandAst>();
		while (token.getType() != TokenType.EOF) {
			commands.add(COMMAND());
		}
		return new Program(commands);
	}

	// COMMAND : LOAD | SKIP | TRIM | CLEAN | FILLNA | RENAME | FILTER | SELECT | SORT | SAVE | GROUP
	CommandAst COMMAND() {
		if (token.getType().getCommand() == null) {
			throw parserException("Unexpected token " + describe(token) + ", expecting a command");
		}
		switch (token.getType()) {
		case KW_LOAD:
			return LOAD();
		case KW_SKIP:
			return SKIP();
		case KW_TRIM:
			return TRIM();
		case KW_CLEAN:
			return CLEAN();
		case KW_FILLNA:
			return FILLNA();
		case KW_RENAME:
			return RENAME();
		case KW_FILTER:
			return FILTER();
		case KW_SELECT:
			return SELECT();
		case KW_SORT:
			return SORT();
		case KW_SAVE:
			return SAVE();
		case KW_GROUP:
			return GROUP();
		default:
			throw parserException("No grammar for command " + token.getType().getCommand());
		}
	}

	// LOAD : load STRING
	CommandAst LOAD() {
		int line = lexer(TokenType.KW_LOAD, "load").getLine();
		String filename = lexer(TokenType.STRING, "filename string after 'load'").getText();
		return new LoadAst(filename, line);
	}

	// SKIP : skip NUMBER
	CommandAst SKIP() {
		int line = lexer(TokenType.KW_SKIP, "skip").getLine();
		if (token.getType() != TokenType.NUMBER) {
			throw parserException("Expecting number after 'skip'. Found: " + describe(token));
		}
		BigDecimal rows = new BigDecimal(token.getText()).stripTrailingZeros();
		if (rows.signum() < 0 || rows.scale() > 0) {
			throw parserException("Expecting a non-negative integer row count after 'skip'. Found: " + describe(token));
		}
		if (rows.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
			throw parserException("Row count after 'skip' is too large (at most " + Integer.MAX_VALUE + "). Found: " + describe(token));
		}
		int rowCount = rows.intValue();
		lexer();
		return new SkipAst(rowCount, line);
	}

	// TRIM : trim
	CommandAst TRIM() {
		int line = lexer(TokenType.KW_TRIM, "trim").getLine();
		return new TrimAst(line);
	}

	// CLEAN : clean missing ( drop | ffill | bfill ) | clean duplicates
	CommandAst CLEAN() {
		int line = lexer(TokenType.KW_CLEAN, "clean").getLine();
		if (token.getType() == TokenType.KW_MISSING) {
			lexer();
			MissingStrategy strategy;
			switch (token.getType()) {
			case KW_DROP:
				strategy = MissingStrategy.DROP;
				break;
			case KW_FFILL:
				strategy = MissingStrategy.FORWARD_FILL;
				break;
			case KW_BFILL:
				strategy = MissingStrategy.BACKWARD_FILL;
				break;
			default:
				throw parserException("Expecting drop, ffill or bfill after 'clean missing'. Found: " + describe(token));
			}
			lexer();
			return CleanAst.missing(strategy, line);
		} else if (token.getType() == TokenType.KW_DUPLICATES) {
			lexer();
			return CleanAst.duplicates(line);
		}
		throw parserException("Expecting 'missing' or 'duplicates' after 'clean'. Found: " + describe(token));
	}

	// FILLNA : fillna ID ( NUMBER | NAN | STRING | ID )
	CommandAst FILLNA() {
		int line = lexer(TokenType.KW_FILLNA, "fillna").getLine();
		String column = lexer(TokenType.ID, "column name after 'fillna'").getText();
		Literal value;
		switch (token.getType()) {
		case NUMBER:
			value = Literal.number(token.getText());
			break;
		case NAN:
			value = Literal.missing();
			break;
		case STRING:
		case ID:
			value = Literal.string(token.getText());
			break;
		default:
			throw parserException("Expecting fill value after 'fillna " + column + "'. Found: " + describe(token));
		}
		lexer();
		return CleanAst.fillNa(column, value, line);
	}

	// RENAME : rename ID to ID
	CommandAst RENAME() {
		int line = lexer(TokenType.KW_RENAME, "rename").getLine();
		String oldName = lexer(TokenType.ID, "old column name after 'rename'").getText();
		lexer(TokenType.KW_TO, "'to'");
		String newName = lexer(TokenType.ID, "new column name after 'to'").getText();
		return new RenameAst(oldName, newName, line);
	}

	// FILTER : filter ID ( == | != | > | < | >= | <= ) VALUE
	CommandAst FILTER() {
		int line = lexer(TokenType.KW_FILTER, "filter").getLine();
		String column = lexer(TokenType.ID, "column name after 'filter'").getText();
		ComparisonOperator operator;
		switch (token.getType()) {
		case EQ:
			operator = ComparisonOperator.EQ;
			break;
		case NE:
			operator = ComparisonOperator.NE;
			break;
		case GT:
			operator = ComparisonOperator.GT;
			break;
		case LT:
			operator = ComparisonOperator.LT;
			break;
		case GE:
			operator = ComparisonOperator.GE;
			break;
		case LE:
			operator = ComparisonOperator.LE;
			break;
		default:
			throw parserException("Expecting comparison operator after 'filter " + column + "'. Found: " + describe(token));
		}
		lexer();
		return new FilterAst(column, operator, VALUE(), line);
	}

	// VALUE : NUMBER | NAN | STRING | ID | keyword
	// anything but a number is compared as a string
	Literal VALUE() {
		Literal value;
		if (token.getType() == TokenType.NUMBER) {
			value = Literal.number(token.getText());
		} else if (token.getType() == TokenType.NAN) {
			value = Literal.missing();
		} else if (token.getType() == TokenType.STRING || token.getType() == TokenType.ID || token.getType().isKeyword()) {
			value = Literal.string(token.getText());
		} else {
			throw parserException("Expecting value. Found: " + describe(token));
		}
		lexer();
		return value;
	}

	// SELECT : select ID { , ID }
	CommandAst SELECT() {
		int line = lexer(TokenType.KW_SELECT, "select").getLine();
		List<String> columns = new ArrayList<String>();
		columns.add(lexer(TokenType.ID, "column name after 'select'").getText());
		while (token.getType() == TokenType.COMMA) {
			lexer();
			columns.add(lexer(TokenType.ID, "column name after ','").getText());
		}
		return new SelectAst(columns, line);
	}

	// SORT : sort by ID [ asc | desc ]
	CommandAst SORT() {
		int line = lexer(TokenType.KW_SORT, "sort").getLine();
		lexer(TokenType.KW_BY, "'by' after 'sort'");
		String column = lexer(TokenType.ID, "column name after 'sort by'").getText();
		SortOrder order = SortOrder.ASC;
		if (token.getType() == TokenType.KW_ASC) {
			lexer();
		} else if (token.getType() == TokenType.KW_DESC) {
			lexer();
			order = SortOrder.DESC;
		}
		return new SortAst(column, order, line);
	}

	// SAVE : save STRING
	CommandAst SAVE() {
		int line = lexer(TokenType.KW_SAVE, "save").getLine();
		String filename = lexer(TokenType.STRING, "filename string after 'save'").getText();
		return new SaveAst(filename, line);
	}

	// GROUP : group by ID ( sum | avg | count | max | min ) ID
	CommandAst GROUP() {
		int line = lexer(TokenType.KW_GROUP, "group").getLine();
		lexer(TokenType.KW_BY, "'by' after 'group'");
		String byColumn = lexer(TokenType.ID, "group column after 'group by'").getText();
		AggregateFunction function;
		switch (token.getType()) {
		case KW_SUM:
			function = AggregateFunction.SUM;
			break;
		case KW_AVG:
			function = AggregateFunction.AVG;
			break;
		case KW_COUNT:
			function = AggregateFunction.COUNT;
			break;
		case KW_MAX:
			function = AggregateFunction.MAX;
			break;
		case KW_MIN:
			function = AggregateFunction.MIN;
			break;
		default:
			throw parserException("Expecting aggregate function (sum, avg, count, max, min). Found: " + describe(token));
		}
		lexer();
		String aggregateColumn = lexer(TokenType.ID, "aggregate column after '" + function.getKeyword() + "'").getText();
		return new GroupByAst(byColumn, function, aggregateColumn, line);
	}

	// CHECKSTYLE.ON MethodName

	private ParserException parserException(String msg) {
		return new ParserException(msg, sourceDescription, token);
	}
}
