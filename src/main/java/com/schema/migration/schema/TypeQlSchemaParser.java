package com.schema.migration.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses TypeQL {@code define} text into a {@link SchemaModel}.
 *
 * <p>Understands attribute, entity and relation definitions ({@code sub}, {@code @abstract},
 * {@code owns} with {@code @key}/{@code @unique}/{@code @card}, {@code relates} with
 * {@code @card}) and the single-clause extensions emitted by migrations, such as
 * {@code define person owns email;}. {@code plays} clauses, attribute value constraints,
 * {@code struct} and {@code fun} definitions and {@code #} comments are skipped.</p>
 *
 * <p>Definitions follow {@code define} semantics: a type defined twice is merged.</p>
 */
public class TypeQlSchemaParser implements SchemaIntrospector {
    private static final Logger log = LoggerFactory.getLogger(TypeQlSchemaParser.class);

    private static final Set<String> STATEMENT_KEYWORDS =
            Set.of("define", "attribute", "entity", "relation", "struct", "fun");

    @Override
    public SchemaModel introspect(String schemaText) {
        return parse(schemaText);
    }

    /**
     * Parses a complete schema.
     *
     * @throws InvalidSchemaException on syntax errors or an invalid resulting model
     */
    public SchemaModel parse(String schemaText) {
        if (schemaText == null || schemaText.isBlank()) {
            return SchemaModel.empty();
        }
        SchemaModel.Builder builder = SchemaModel.builder();
        new Parser(tokenize(schemaText), builder).parseAll();
        return builder.build();
    }

    /**
     * Applies {@code define} statements on top of an existing model, the way the store
     * extends its schema.
     */
    public SchemaModel apply(SchemaModel current, String defineText) {
        if (defineText == null || defineText.isBlank()) {
            return current;
        }
        SchemaModel.Builder builder = current.toBuilder();
        new Parser(tokenize(defineText), builder).parseAll();
        return builder.build();
    }

    // --- Lexer ---

    enum TokenType { WORD, ANNOTATION, STRING, CARD, VARIABLE, PUNCT, OTHER }

    record Token(TokenType type, String text, int line) {
        boolean is(String value) {
            return text.equals(value);
        }
    }

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int line = 1;
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#') {
                while (i < n && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '"') {
                int start = i++;
                while (i < n && text.charAt(i) != '"') {
                    if (text.charAt(i) == '\\') {
                        i++;
                    } else if (text.charAt(i) == '\n') {
                        line++;
                    }
                    i++;
                }
                if (i >= n) {
                    throw new InvalidSchemaException("Unterminated string literal at line " + line);
                }
                i++;
                tokens.add(new Token(TokenType.STRING, text.substring(start, i), line));
            } else if (c == '@' || c == '$') {
                int start = i++;
                while (i < n && isWordChar(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(c == '@' ? TokenType.ANNOTATION : TokenType.VARIABLE, text.substring(start, i), line));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                if (text.startsWith("..", i)) {
                    i += 2;
                    while (i < n && Character.isDigit(text.charAt(i))) {
                        i++;
                    }
                }
                tokens.add(new Token(TokenType.CARD, text.substring(start, i), line));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && isWordChar(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, text.substring(start, i), line));
            } else if (";,:()[]{}?".indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.PUNCT, String.valueOf(c), line));
                i++;
            } else {
                tokens.add(new Token(TokenType.OTHER, String.valueOf(c), line));
                i++;
            }
        }
        return tokens;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    // --- Parser ---

    private static final class Parser {
        private final List<Token> tokens;
        private final SchemaModel.Builder builder;
        private int pos;

        private Parser(List<Token> tokens, SchemaModel.Builder builder) {
            this.tokens = tokens;
            this.builder = builder;
        }

        void parseAll() {
            while (!atEnd()) {
                Token token = next();
                if (token.type() != TokenType.WORD) {
                    throw error(token, "expected a definition");
                }
                switch (token.text()) {
                    case "define" -> { }
                    case "attribute" -> parseAttribute();
                    case "entity" -> parseEntity();
                    case "relation" -> parseRelation();
                    case "struct" -> skipStatement();
                    case "fun" -> skipFunction(token);
                    default -> parseExtension(token);
                }
            }
        }

        private void parseAttribute() {
            String name = expectWord("attribute name");
            ValueType valueType = null;
            while (!peekIs(";")) {
                Token token = next();
                if (token.is(",")) {
                    continue;
                }
                if (token.is("value")) {
                    Token type = next();
                    try {
                        valueType = ValueType.fromKeyword(type.text());
                    } catch (InvalidSchemaException e) {
                        throw error(type, "unsupported value type '" + type.text() + "' for attribute '" + name + "'");
                    }
                } else if (token.is("sub")) {
                    expectWord("attribute supertype");
                } else if (token.type() == TokenType.ANNOTATION) {
                    skipAnnotationArguments();
                } else {
                    throw error(token, "unexpected '" + token.text() + "' in attribute '" + name + "'");
                }
            }
            expect(";");
            if (valueType == null) {
                throw new InvalidSchemaException("Attribute '" + name + "' has no value type");
            }
            builder.defineAttribute(new AttributeSpec(name, valueType));
        }

        private void parseEntity() {
            TypeHeader header = new TypeHeader(expectWord("entity name"));
            List<OwnsSpec> owns = new ArrayList<>();
            while (!peekIs(";")) {
                Token token = next();
                if (token.is(",")) {
                    continue;
                }
                if (token.is("owns")) {
                    owns.add(parseOwns());
                } else if (token.is("plays")) {
                    skipPlays();
                } else if (token.is("sub")) {
                    header.parent = expectWord("entity supertype");
                } else if (token.is("@abstract")) {
                    header.isAbstract = true;
                } else {
                    throw error(token, "unexpected '" + token.text() + "' in entity '" + header.name + "'");
                }
            }
            expect(";");
            builder.defineEntity(new EntitySpec(header.name, header.parent, header.isAbstract, owns));
        }

        private void parseRelation() {
            TypeHeader header = new TypeHeader(expectWord("relation name"));
            List<RoleSpec> relates = new ArrayList<>();
            List<OwnsSpec> owns = new ArrayList<>();
            while (!peekIs(";")) {
                Token token = next();
                if (token.is(",")) {
                    continue;
                }
                if (token.is("relates")) {
                    relates.add(parseRelates());
                } else if (token.is("owns")) {
                    owns.add(parseOwns());
                } else if (token.is("plays")) {
                    skipPlays();
                } else if (token.is("sub")) {
                    header.parent = expectWord("relation supertype");
                } else if (token.is("@abstract")) {
                    header.isAbstract = true;
                } else {
                    throw error(token, "unexpected '" + token.text() + "' in relation '" + header.name + "'");
                }
            }
            expect(";");
            builder.defineRelation(new RelationSpec(header.name, header.parent, header.isAbstract, relates, owns));
        }

        /**
         * {@code <type> owns a ...}, {@code <type> relates r ...} or {@code <type> plays r:x}
         * applied to an already defined type.
         */
        private void parseExtension(Token typeName) {
            while (!peekIs(";")) {
                Token token = next();
                if (token.is(",")) {
                    continue;
                }
                if (token.is("owns")) {
                    builder.addOwns(typeName.text(), parseOwns());
                } else if (token.is("relates")) {
                    builder.addRelates(typeName.text(), parseRelates());
                } else if (token.is("plays")) {
                    skipPlays();
                } else {
                    throw error(token, "unsupported clause '" + token.text() + "' for type '" + typeName.text() + "'");
                }
            }
            expect(";");
        }

        private OwnsSpec parseOwns() {
            String attribute = expectWord("owned attribute");
            skipListMarker();
            boolean key = false;
            boolean unique = false;
            String card = null;
            while (peekType(TokenType.ANNOTATION)) {
                Token annotation = next();
                switch (annotation.text()) {
                    case "@key" -> key = true;
                    case "@unique" -> unique = true;
                    case "@card" -> card = parseCardinality();
                    default -> skipAnnotationArguments();
                }
            }
            return new OwnsSpec(attribute, key, unique, card);
        }

        private RoleSpec parseRelates() {
            String role = expectWord("role name");
            if (peekIs("as")) {
                next();
                expectWord("overridden role");
            }
            skipListMarker();
            String card = null;
            while (peekType(TokenType.ANNOTATION)) {
                Token annotation = next();
                if (annotation.is("@card")) {
                    card = parseCardinality();
                } else {
                    skipAnnotationArguments();
                }
            }
            return new RoleSpec(role, card);
        }

        private String parseCardinality() {
            expect("(");
            Token card = next();
            if (card.type() != TokenType.CARD) {
                throw error(card, "expected a cardinality");
            }
            expect(")");
            return card.text();
        }

        private void skipPlays() {
            expectWord("played relation");
            expect(":");
            expectWord("played role");
        }

        private void skipListMarker() {
            if (peekIs("[")) {
                next();
                expect("]");
            }
        }

        private void skipAnnotationArguments() {
            if (!peekIs("(")) {
                return;
            }
            int depth = 0;
            do {
                Token token = next();
                if (token.is("(")) {
                    depth++;
                } else if (token.is(")")) {
                    depth--;
                }
            } while (depth > 0);
        }

        private void skipStatement() {
            while (!peekIs(";")) {
                next();
            }
            expect(";");
        }

        // a function body ends where the next top-level definition starts
        private void skipFunction(Token start) {
            log.debug("Skipping function definition at line {}", start.line());
            boolean statementStart = false;
            while (!atEnd()) {
                Token token = tokens.get(pos);
                if (token.is("fun") || (statementStart && STATEMENT_KEYWORDS.contains(token.text()))) {
                    return;
                }
                statementStart = token.is(";");
                pos++;
            }
        }

        private String expectWord(String what) {
            Token token = next();
            if (token.type() != TokenType.WORD) {
                throw error(token, "expected " + what + " but found '" + token.text() + "'");
            }
            return token.text();
        }

        private void expect(String text) {
            Token token = next();
            if (!token.is(text)) {
                throw error(token, "expected '" + text + "' but found '" + token.text() + "'");
            }
        }

        private boolean peekIs(String text) {
            if (atEnd()) {
                throw new InvalidSchemaException("Unexpected end of schema text, expected '" + text + "'");
            }
            return tokens.get(pos).is(text);
        }

        private boolean peekType(TokenType type) {
            return !atEnd() && tokens.get(pos).type() == type;
        }

        private Token next() {
            if (atEnd()) {
                throw new InvalidSchemaException("Unexpected end of schema text");
            }
            return tokens.get(pos++);
        }

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private InvalidSchemaException error(Token token, String message) {
            return new InvalidSchemaException("Line " + token.line() + ": " + message);
        }
    }

    /**
     * The {@code sub} and {@code @abstract} modifiers of a type definition, which may
     * appear in the header or as clauses.
     */
    private static final class TypeHeader {
        private final String name;
        private String parent;
        private boolean isAbstract;

        private TypeHeader(String name) {
            this.name = name;
        }
    }
}
