package com.raditha.cpptokens.analyzer;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.lexer.Lexer;
import com.raditha.cpptokens.lexer.SimpleLexer;
import com.raditha.cpptokens.model.InternalAnalysisError;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.tokenlist.TokenList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the token list pipeline over translation units.
 * <p>
 * For each unit: tokenize, normalize platform and standard types, link brackets,
 * build and validate the AST, hash. An {@link InternalAnalysisError} fails only the
 * unit it was raised for.
 */
public class TranslationUnitAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TranslationUnitAnalyzer.class);

    private final Settings settings;
    private final Language language;
    private final Lexer lexer;
    private final boolean printAst;

    public TranslationUnitAnalyzer(Settings settings) {
        this(settings, Language.NONE, new SimpleLexer(), false);
    }

    /**
     * @param language forced language, or {@link Language#NONE} to detect it per file
     * @param printAst log a dump of the broken expression when validation fails
     */
    public TranslationUnitAnalyzer(Settings settings, Language language, Lexer lexer, boolean printAst) {
        this.settings = settings;
        this.language = language;
        this.lexer = lexer;
        this.printAst = printAst;
    }

    /**
     * @throws IOException if the file cannot be read
     */
    public UnitReport analyze(Path file) throws IOException {
        String code = Files.readString(file, StandardCharsets.UTF_8);
        return analyze(new StringReader(code), file.toString());
    }

    public UnitReport analyze(Reader code, String fileName) {
        TokenList tokenList = new TokenList(settings, language, lexer);
        if (!tokenList.createTokens(code, fileName)) {
            logger.warn("Skipping {}: tokenization failed", fileName);
            return UnitReport.failed(fileName, tokenList.getLanguage().name(), tokenList.size(),
                    UnitReport.Status.LEXER_ERROR, "Tokenization failed");
        }
        return analyze(tokenList);
    }

    /**
     * Run the passes after tokenization on an already filled list.
     */
    public UnitReport analyze(TokenList tokenList) {
        String fileName = tokenList.getSourceFilePath();
        String languageName = tokenList.getLanguage().name();
        try {
            tokenList.simplifyPlatformTypes();
            tokenList.simplifyStdType();
            tokenList.createAst();
            tokenList.validateAst(printAst);
        } catch (InternalAnalysisError e) {
            logger.warn("Skipping {}: {}", fileName, e.getMessage());
            return UnitReport.failed(fileName, languageName, tokenList.size(), UnitReport.Status.AST_ERROR,
                    e.getMessage());
        }
        List<String> expressions = new ArrayList<>();
        for (Token tok = tokenList.front(); tok != null; tok = tok.next()) {
            if (tok.astParent() == null && (tok.astOperand1() != null || tok.astOperand2() != null)) {
                expressions.add(tok.astString(" ").trim());
            }
        }
        UnitReport report = new UnitReport(fileName, languageName, tokenList.size(), tokenList.calculateHash(),
                expressions.size(), expressions, UnitReport.Status.OK, null);
        logger.info("{}", report.getSummary());
        return report;
    }
}
