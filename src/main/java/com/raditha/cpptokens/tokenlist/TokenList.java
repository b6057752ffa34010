package com.raditha.cpptokens.tokenlist;

import com.raditha.cpptokens.ast.AstBuilder;
import com.raditha.cpptokens.ast.AstValidator;
import com.raditha.cpptokens.ast.PrecedencePolicy;
import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.config.Standards;
import com.raditha.cpptokens.hash.TokenListHasher;
import com.raditha.cpptokens.lexer.LexedTokens;
import com.raditha.cpptokens.lexer.Lexer;
import com.raditha.cpptokens.lexer.LexerException;
import com.raditha.cpptokens.lexer.RawToken;
import com.raditha.cpptokens.lexer.SimpleLexer;
import com.raditha.cpptokens.model.InternalAnalysisError;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.model.TokenOwner;
import com.raditha.cpptokens.model.TokensFrontBack;
import com.raditha.cpptokens.normalization.PlatformTypeSimplifier;
import com.raditha.cpptokens.normalization.StdTypeSimplifier;
import com.raditha.cpptokens.scan.BracketMatcher;
import com.raditha.cpptokens.scan.FunctionHeadScanner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * The tokens of one translation unit as a doubly linked list, with the files they
 * came from and the AST built over them.
 * <p>
 * Bounds live in a {@link TokensFrontBack} shared with every token, so token level
 * edits keep {@link #front()} and {@link #back()} current and a list can be handed
 * to a new owner with {@link #relocate(TokenList)} without touching the tokens.
 * <p>
 * Not thread safe. One list belongs to one analysis pipeline at a time.
 */
public class TokenList implements TokenOwner {

    private static final Logger logger = LoggerFactory.getLogger(TokenList.class);

    private static final Set<String> CPP_NON_KEYWORD_TYPES = Set.of("bool", "false", "true");
    private static final Set<String> C_NON_KEYWORD_TYPES = Set.of("char", "double", "float", "int", "long", "short");

    private final Settings settings;
    private final Lexer lexer;
    private final FileRegistry files = new FileRegistry();
    private TokensFrontBack frontBack;
    private Language language;

    public TokenList(Settings settings) {
        this(settings, Language.NONE);
    }

    public TokenList(Settings settings, Language language) {
        this(settings, language, new SimpleLexer());
    }

    /**
     * @param settings read-only settings, shared and never copied
     * @param language language of the code, or {@link Language#NONE} to detect it
     *                 from the first registered file
     * @param lexer    lexer used by {@link #createTokens(Reader, String)}
     */
    public TokenList(Settings settings, Language language, Lexer lexer) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
        this.language = language == null ? Language.NONE : language;
        this.lexer = lexer;
        this.frontBack = new TokensFrontBack(this);
    }

    /**
     * Move the tokens, files and language of {@code from} into a new list. The
     * bounds record is handed over rather than copied, so every token and every
     * reference obtained from {@code from.front()} stays valid. {@code from} is
     * left empty.
     */
    public static TokenList relocate(TokenList from) {
        TokenList to = new TokenList(from.settings, from.language, from.lexer);
        to.frontBack = from.frontBack;
        to.frontBack.owner(to);
        to.files.copyFrom(from.files);
        from.frontBack = new TokensFrontBack(from);
        from.files.clear();
        return to;
    }

    // ---------------------------------------------------------------- TokenOwner

    /**
     * Keyword check for the list's language and the configured standard. Standard
     * type names are never keywords here, they are classified as types.
     */
    @Override
    public boolean isKeyword(String str) {
        Standards standards = settings.standards();
        if (isCPP()) {
            if (CPP_NON_KEYWORD_TYPES.contains(str)) {
                return false;
            }
            return Keywords.getAll(standards.cpp()).contains(str);
        }
        if (C_NON_KEYWORD_TYPES.contains(str)) {
            return false;
        }
        return Keywords.getAll(standards.c()).contains(str);
    }

    @Override
    public boolean isCPP() {
        return language == Language.CPP;
    }

    public boolean isC() {
        return language == Language.C;
    }

    public Language getLanguage() {
        return language;
    }

    /**
     * @throws IllegalStateException if a different language was already set
     */
    public void setLanguage(Language newLanguage) {
        if (language != Language.NONE && language != newLanguage) {
            throw new IllegalStateException("Language has already been set to " + language);
        }
        language = newLanguage;
    }

    public Settings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------- adding tokens

    /**
     * Append a token. Empty values are ignored, a value starting with {@code ##}
     * is added as two tokens.
     *
     * @param split marks the token as one part of a value that was split apart
     */
    public void addtoken(String str, int lineNumber, int column, int fileIndex, boolean split) {
        if (str == null || str.isEmpty()) {
            return;
        }
        if (str.startsWith("##") && str.length() > 2) {
            addtoken("##", lineNumber, column, fileIndex, split);
            addtoken(str.substring(2), lineNumber, column, fileIndex, split);
            return;
        }
        Token tok = appendToken(str);
        tok.lineNumber(lineNumber);
        tok.column(column);
        tok.fileIndex(fileIndex);
        tok.isSplit(split);
    }

    public void addtoken(String str, int lineNumber, int column, int fileIndex) {
        addtoken(str, lineNumber, column, fileIndex, false);
    }

    /**
     * Append a token located where {@code locationTok} is. Only the location is taken
     * from {@code locationTok}.
     */
    public void addtoken(String str, Token locationTok) {
        if (str == null || str.isEmpty()) {
            return;
        }
        addtoken(str, locationTok.lineNumber(), locationTok.column(), locationTok.fileIndex());
    }

    /**
     * Append a copy of {@code tok}'s value, original name and flags at the given location.
     */
    public void addtoken(@Nullable Token tok, int lineNumber, int column, int fileIndex) {
        if (tok == null) {
            return;
        }
        Token copy = appendToken(tok.str());
        copy.originalName(tok.originalName());
        copy.macroName(tok.macroName());
        copy.flags(tok.flags());
        copy.lineNumber(lineNumber);
        copy.column(column);
        copy.fileIndex(fileIndex);
    }

    /**
     * Append a copy of {@code tok}'s value, original name and flags, located where
     * {@code locationTok} is.
     */
    public void addtoken(@Nullable Token tok, Token locationTok) {
        if (tok == null) {
            return;
        }
        addtoken(tok, locationTok.lineNumber(), locationTok.column(), locationTok.fileIndex());
    }

    /**
     * Append a copy of {@code tok}, location included.
     */
    public void addtoken(@Nullable Token tok) {
        if (tok == null) {
            return;
        }
        addtoken(tok, tok.lineNumber(), tok.column(), tok.fileIndex());
    }

    private Token appendToken(String str) {
        Token back = frontBack.back();
        if (back != null) {
            return back.insertToken(str);
        }
        Token tok = new Token(frontBack);
        tok.str(str);
        frontBack.front(tok);
        frontBack.back(tok);
        return tok;
    }

    /**
     * Insert copies of {@code n} tokens starting at {@code src} after {@code dest}.
     * Brackets among the copies are linked to each other.
     */
    public static void insertTokens(Token dest, Token src, int n) {
        Deque<Token> links = new ArrayDeque<>();
        Token to = dest;
        Token from = src;
        while (n > 0 && from != null) {
            to = to.insertToken(from.str());
            copyAttributes(from, to);
            to.lineNumber(from.lineNumber());
            to.column(from.column());
            to.fileIndex(from.fileIndex());
            linkCopy(to, links);
            from = from.next();
            n--;
        }
    }

    /**
     * Insert copies of the inclusive range {@code [first, last]} after {@code dest}.
     * The copies take {@code dest}'s file. With {@code oneLine} they all take
     * {@code dest}'s line, otherwise the line breaks of the range are repeated
     * starting at {@code dest}'s line.
     *
     * @return the last copy
     * @throws InternalAnalysisError if {@code last} cannot be reached from {@code first}
     */
    public static Token copyTokens(Token dest, Token first, Token last, boolean oneLine) {
        Token end = first;
        while (end != null && end != last) {
            end = end.next();
        }
        if (end == null) {
            throw new InternalAnalysisError(first, "Internal error. copyTokens: range end is not reachable from its start",
                    InternalAnalysisError.Kind.INTERNAL);
        }
        Deque<Token> links = new ArrayDeque<>();
        Token to = dest;
        int line = dest.lineNumber();
        int fileIndex = dest.fileIndex();
        Token stop = last.next();
        for (Token from = first; from != stop; from = from.next()) {
            to = to.insertToken(from.str());
            copyAttributes(from, to);
            to.fileIndex(fileIndex);
            to.lineNumber(line);
            to.column(from.column());
            linkCopy(to, links);
            if (!oneLine && from.next() != null) {
                line += from.next().lineNumber() - from.lineNumber();
            }
        }
        return to;
    }

    public static Token copyTokens(Token dest, Token first, Token last) {
        return copyTokens(dest, first, last, true);
    }

    private static void copyAttributes(Token from, Token to) {
        to.tokType(from.tokType());
        to.flags(from.flags());
        to.originalName(from.originalName());
        to.macroName(from.macroName());
    }

    private static void linkCopy(Token copy, Deque<Token> links) {
        if (BracketMatcher.isOpening(copy.str())) {
            links.push(copy);
        } else if (BracketMatcher.isClosing(copy.str()) && !links.isEmpty()) {
            Token.createMutualLinks(links.pop(), copy);
        }
    }

    // ---------------------------------------------------------------- construction

    /**
     * Tokenize preprocessed code with this list's lexer.
     *
     * @param file0 name of the main file, registered first
     * @return false if the lexer failed or reported problems; the tokens it did
     *         produce are kept
     * @throws IllegalStateException if the list already has tokens
     */
    public boolean createTokens(Reader code, String file0) {
        requireEmpty();
        String mainFile = file0 == null ? "" : file0;
        appendFileIfNew(mainFile);
        LexedTokens lexed;
        try {
            lexed = lexer.lex(code, files.files(), mainFile);
        } catch (LexerException e) {
            logger.warn("Cannot tokenize {}: {}", mainFile, e.getMessage());
            return false;
        }
        createTokens(lexed);
        for (String diagnostic : lexed.diagnostics()) {
            logger.warn("{}", diagnostic);
        }
        return !lexed.hasDiagnostics();
    }

    public boolean createTokens(Reader code) {
        return createTokens(code, "");
    }

    /**
     * Take over the tokens and the file table of a lexer result. The argument is
     * consumed.
     *
     * @throws IllegalStateException if the list already has tokens
     */
    public void createTokens(LexedTokens lexed) {
        requireEmpty();
        files.reset(lexed.files());
        if (language == Language.NONE && !files.isEmpty()) {
            language = SourcePaths.identify(files.get(0), settings.cppHeaderProbe());
        }
        RawToken raw;
        while ((raw = lexed.poll()) != null) {
            String str = raw.str();
            if (str.length() > 1 && str.charAt(0) == '.' && Character.isDigit(str.charAt(1))) {
                str = "0" + str;
            }
            Token tok = appendToken(str);
            tok.fileIndex(raw.fileIndex());
            tok.lineNumber(raw.line());
            tok.column(raw.column());
            tok.macroName(raw.macro());
        }
        if (settings.relativePaths()) {
            files.rename(path -> SourcePaths.relative(path, settings.basePaths()));
        }
        Token.assignProgressValues(front());
        logger.debug("Created {} tokens from {} files", size(), files.size());
    }

    private void requireEmpty() {
        if (!frontBack.isEmpty()) {
            throw new IllegalStateException("Token list is not empty");
        }
    }

    /**
     * Delete every token and forget the files. References to the deleted tokens
     * must not be used afterwards.
     */
    public void deallocateTokens() {
        deleteTokens(frontBack.front());
        frontBack.front(null);
        frontBack.back(null);
        files.clear();
    }

    /**
     * Delete {@code tok} and every token after it, unlinking their brackets and AST.
     * A first token of a list is only detached from its successors; resetting the
     * list bounds is up to the owner, see {@link #deallocateTokens()}.
     */
    public static void deleteTokens(@Nullable Token tok) {
        if (tok == null) {
            return;
        }
        Token prev = tok.previous();
        if (prev != null) {
            prev.deleteNext(Integer.MAX_VALUE);
            return;
        }
        tok.deleteNext(Integer.MAX_VALUE);
        tok.unlinkAst();
        if (tok.link() != null && tok.link().link() == tok) {
            tok.link().link(null);
        }
        tok.link(null);
    }

    // ---------------------------------------------------------------- access

    public @Nullable Token front() {
        return frontBack.front();
    }

    public @Nullable Token back() {
        return frontBack.back();
    }

    public boolean isEmpty() {
        return frontBack.isEmpty();
    }

    public int size() {
        int count = 0;
        for (Token tok = front(); tok != null; tok = tok.next()) {
            count++;
        }
        return count;
    }

    // ---------------------------------------------------------------- files

    /**
     * @return the index of {@code fileName}, registering it if it is new
     */
    public int appendFileIfNew(String fileName) {
        boolean first = files.isEmpty();
        int index = files.appendIfNew(fileName);
        if (first && language == Language.NONE) {
            language = SourcePaths.identify(fileName, settings.cppHeaderProbe());
        }
        return index;
    }

    public List<String> getFiles() {
        return files.files();
    }

    /**
     * @return the main file, or "" if no file is registered
     */
    public String getSourceFilePath() {
        return files.isEmpty() ? "" : files.get(0);
    }

    public String file(Token tok) {
        return files.get(tok.fileIndex());
    }

    /**
     * @return "path:line" of the token
     */
    public String fileLine(Token tok) {
        return file(tok) + ":" + tok.lineNumber();
    }

    /**
     * @return the original name of the token's file, or its current name when the
     *         two never diverged
     */
    public String getOrigFile(Token tok) {
        return files.getOriginal(tok.fileIndex());
    }

    /**
     * Record the current file names as the original ones, for lists built from
     * inputs whose file names are rewritten afterwards.
     */
    public void clangSetOrigFiles() {
        files.snapshotOriginals();
    }

    // ---------------------------------------------------------------- passes

    public long calculateHash() {
        return TokenListHasher.hash(front());
    }

    /**
     * Link matching brackets.
     *
     * @throws InternalAnalysisError of kind SYNTAX on unbalanced brackets
     */
    public void createLinks() {
        int pairs = BracketMatcher.createLinks(front());
        logger.debug("Linked {} bracket pairs", pairs);
    }

    /**
     * Link brackets and build the expression trees of every statement.
     *
     * @throws InternalAnalysisError of kind SYNTAX on unbalanced brackets
     */
    public void createAst() {
        if (isEmpty()) {
            return;
        }
        createLinks();
        Token.assignIndexes(front());
        new AstBuilder(PrecedencePolicy.forLanguage(language)).build(front());
    }

    /**
     * @param print log and attach a dump of the broken expression
     * @throws InternalAnalysisError of kind AST if the AST is broken
     */
    public void validateAst(boolean print) {
        new AstValidator(this::fileLine).validate(front(), print);
    }

    /**
     * @return true if {@code tok} is null or belongs to this list
     */
    public boolean validateToken(@Nullable Token tok) {
        if (tok == null) {
            return true;
        }
        for (Token t = front(); t != null; t = t.next()) {
            if (t == tok) {
                return true;
            }
        }
        return false;
    }

    public void simplifyPlatformTypes() {
        boolean cpp11 = isCPP() && settings.standards().cpp().atLeast(Standards.CppStandard.CPP11);
        new PlatformTypeSimplifier(settings.platform(), settings.platformTypes(), cpp11).simplify(front());
    }

    public void simplifyStdType() {
        new StdTypeSimplifier(isC()).simplify(front());
    }

    /**
     * @see FunctionHeadScanner#isFunctionHead(Token, String)
     */
    public static @Nullable Token isFunctionHead(@Nullable Token tok, String endsWith) {
        return FunctionHeadScanner.isFunctionHead(tok, endsWith);
    }

    /**
     * Render the list as text, one source line per output line.
     */
    public String stringify() {
        StringBuilder sb = new StringBuilder();
        int line = -1;
        int fileIndex = -1;
        for (Token tok = front(); tok != null; tok = tok.next()) {
            if (tok.fileIndex() != fileIndex) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("##file ").append(file(tok)).append('\n');
                fileIndex = tok.fileIndex();
                line = tok.lineNumber();
                sb.append(line).append(':');
            } else if (tok.lineNumber() != line) {
                sb.append('\n').append(tok.lineNumber()).append(':');
                line = tok.lineNumber();
            }
            sb.append(' ').append(tok.str());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TokenList[" + getSourceFilePath() + ", " + language + "]";
    }
}
