package com.statuta.compiler.parser;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.item.FieldDecl;
import com.statuta.compiler.ast.type.*;
import com.statuta.compiler.lexer.Token;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.statuta.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    List<String> parseTypeParams() {
        parser.expect(LT, "Expected '<'");
        List<String> params = new ArrayList<>();

        do {
            params.add(parser.expect(IDENTIFIER, "Expected type parameter name").getLexeme());
        } while (parser.match(COMMA));

        parser.expect(GT, "Expected '>' after type parameters");
        return params;
    }

    /**
     * 类型：{@code primary ('||' primary)*}
     */
    TypeRef parseType() {
        SourceLocation loc = parser.location();
        TypeRef first = parsePrimaryType();
        if (!parser.check(OR)) {
            return first;
        }
        List<TypeRef> members = new ArrayList<>();
        members.add(first);
        while (parser.match(OR)) {
            members.add(parsePrimaryType());
        }
        return new UnionType(loc, members);
    }

    /** 当前 token 能否开始一个类型 */
    boolean isTypeStart() {
        return parser.current.getType().isTypeKeyword()
                || parser.checkAny(IDENTIFIER, KW_PASS, LBRACE);
    }

    private TypeRef parsePrimaryType() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case KW_INT: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.INT);
            case KW_FLOAT: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.FLOAT);
            case KW_STRING: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.STRING);
            case KW_BOOL: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.BOOL);
            case KW_PERCENT: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.PERCENT);
            case KW_DATE: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.DATE);
            case KW_DURATION: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.DURATION);
            case KW_PASS: parser.advance(); return new PrimitiveType(loc, PrimitiveType.Kind.PASS);
            case KW_MONEY: return parseMoneyType(loc);
            case KW_BOUNDED_INT: return parseBoundedIntType(loc);
            case KW_TEMPORAL: return parseTemporalType(loc);
            case KW_CITATION: return parseCitationType(loc);
            case KW_ARRAY: return parseWrapperType(loc, WrapperType.Kind.ARRAY);
            case KW_POSITIVE: return parseWrapperType(loc, WrapperType.Kind.POSITIVE);
            case KW_NON_EMPTY: return parseWrapperType(loc, WrapperType.Kind.NON_EMPTY);
            case LBRACE: return parseRecordType(loc);
            case IDENTIFIER: return parseNamedType(loc);
            default:
                throw parser.error("Expected type");
        }
    }

    private TypeRef parseMoneyType(SourceLocation loc) {
        parser.advance(); // money
        String currency = null;
        if (parser.match(LT)) {
            currency = parser.expect(IDENTIFIER, "Expected currency code").getLexeme();
            parser.expect(GT, "Expected '>' after currency code");
        }
        return new MoneyType(loc, currency);
    }

    private TypeRef parseBoundedIntType(SourceLocation loc) {
        parser.advance(); // BoundedInt
        parser.expect(LT, "Expected '<' after BoundedInt");
        long low = parseSignedInt();
        parser.expect(COMMA, "Expected ',' between BoundedInt bounds");
        long high = parseSignedInt();
        parser.expect(GT, "Expected '>' after BoundedInt bounds");
        return new BoundedIntType(loc, low, high);
    }

    private long parseSignedInt() {
        boolean negative = parser.match(MINUS);
        Token number = parser.expect(INT_LITERAL, "Expected integer bound");
        long value = (Long) number.getLiteral();
        return negative ? -value : value;
    }

    private TypeRef parseTemporalType(SourceLocation loc) {
        parser.advance(); // Temporal
        parser.expect(LT, "Expected '<' after Temporal");
        TypeRef inner = parseType();
        LocalDate validFrom = null;
        LocalDate validUntil = null;
        while (parser.match(COMMA)) {
            String key = parser.expect(IDENTIFIER, "Expected 'valid_from' or 'valid_until'").getLexeme();
            parser.expect(EQUALS, "Expected '=' after " + key);
            LocalDate value = parseDateValue();
            if ("valid_from".equals(key)) {
                validFrom = value;
            } else if ("valid_until".equals(key)) {
                validUntil = value;
            } else {
                throw new ParseException("Unknown Temporal parameter '" + key + "'",
                        parser.fileName, parser.previous);
            }
        }
        parser.expect(GT, "Expected '>' after Temporal parameters");
        return new TemporalType(loc, inner, validFrom, validUntil);
    }

    /** 日期值：日期字面量或可解析的日期字符串 */
    LocalDate parseDateValue() {
        if (parser.check(DATE_LITERAL)) {
            return (LocalDate) parser.advance().getLiteral();
        }
        if (parser.check(STRING_LITERAL)) {
            Token token = parser.advance();
            LocalDate date = LiteralHelper.parseDate((String) token.getLiteral());
            if (date == null) {
                throw new ParseException("Invalid date '" + token.getLiteral() + "'", parser.fileName, token);
            }
            return date;
        }
        throw parser.error("Expected date");
    }

    private TypeRef parseCitationType(SourceLocation loc) {
        parser.advance(); // Citation
        parser.expect(LT, "Expected '<' after Citation");
        List<String> parts = new ArrayList<>();
        do {
            parts.add((String) parser.expect(STRING_LITERAL, "Expected citation string").getLiteral());
        } while (parser.match(COMMA));
        parser.expect(GT, "Expected '>' after citation");

        if (parts.size() == 2) {
            return new CitationType(loc, parts.get(0), null, parts.get(1));
        }
        if (parts.size() == 3) {
            String subsection = parts.get(1).isEmpty() ? null : parts.get(1);
            return new CitationType(loc, parts.get(0), subsection, parts.get(2));
        }
        throw new ParseException("Citation takes section, optional subsection and act",
                parser.fileName, parser.previous);
    }

    private TypeRef parseWrapperType(SourceLocation loc, WrapperType.Kind kind) {
        parser.advance();
        parser.expect(LT, "Expected '<' after " + kind.getDisplayName());
        TypeRef inner = parseType();
        parser.expect(GT, "Expected '>'");
        return new WrapperType(loc, kind, inner);
    }

    private TypeRef parseRecordType(SourceLocation loc) {
        parser.expect(LBRACE, "Expected '{'");
        List<FieldDecl> fields = new ArrayList<>();
        while (!parser.check(RBRACE)) {
            fields.add(parser.itemParser.parseField());
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RBRACE, "Expected '}' after record fields");
        return new RecordType(loc, fields);
    }

    private TypeRef parseNamedType(SourceLocation loc) {
        String name = parser.advance().getLexeme();
        List<TypeRef> args = new ArrayList<>();
        if (parser.match(LT)) {
            do {
                args.add(parseType());
            } while (parser.match(COMMA));
            parser.expect(GT, "Expected '>' after type arguments");
        }
        return new NamedType(loc, name, args);
    }
}
