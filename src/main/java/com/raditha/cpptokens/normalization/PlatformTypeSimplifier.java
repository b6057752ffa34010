package com.raditha.cpptokens.normalization;

import com.raditha.cpptokens.config.Platform;
import com.raditha.cpptokens.config.PlatformType;
import com.raditha.cpptokens.config.PlatformTypes;
import com.raditha.cpptokens.match.TokenMatcher;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites platform dependent type names into their canonical spelling for the
 * configured platform.
 * <p>
 * {@code size_t} and friends become {@code int}, {@code long} or {@code long long}
 * depending on {@code sizeof(size_t)}; aliases from the platform type table (for
 * example {@code DWORD} on Windows) become their base type, pointer forms included.
 * The replaced spelling is kept as the token's original name.
 */
public class PlatformTypeSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(PlatformTypeSimplifier.class);

    private static final String UNSIGNED_SIZE_TYPES = "size_t|uintptr_t|uintmax_t";
    private static final String SIGNED_SIZE_TYPES = "ssize_t|ptrdiff_t|intptr_t|intmax_t";

    private enum SizeModel { INT, LONG, LONG_LONG }

    private final Platform platform;
    private final PlatformTypes platformTypes;
    private final boolean cpp11;

    public PlatformTypeSimplifier(Platform platform, PlatformTypes platformTypes, boolean cpp11) {
        this.platform = platform;
        this.platformTypes = platformTypes;
        this.cpp11 = cpp11;
    }

    /**
     * @return the number of tokens rewritten
     */
    public int simplify(Token front) {
        int rewritten = simplifySizeTypes(front) + simplifyAliases(front);
        logger.debug("Platform {}: rewrote {} platform type tokens", platform.name(), rewritten);
        return rewritten;
    }

    private SizeModel sizeModel() {
        if (platform.sizeofSizeT() == platform.sizeofLong()) {
            return SizeModel.LONG;
        }
        if (platform.sizeofSizeT() == platform.sizeofLongLong()) {
            return SizeModel.LONG_LONG;
        }
        if (platform.sizeofSizeT() == platform.sizeofInt()) {
            return SizeModel.INT;
        }
        return null;
    }

    private int simplifySizeTypes(Token front) {
        SizeModel model = sizeModel();
        if (model == null) {
            logger.debug("No integer type has the size of size_t on {}", platform.name());
            return 0;
        }
        int count = 0;
        for (Token tok = front; tok != null; tok = tok.next()) {
            boolean unsigned;
            if (TokenMatcher.match(tok, "std| ::| " + UNSIGNED_SIZE_TYPES)) {
                unsigned = true;
            } else if (TokenMatcher.match(tok, "std| ::| " + SIGNED_SIZE_TYPES)) {
                unsigned = false;
            } else {
                continue;
            }
            // x::size_t names a member of some other scope
            if (tok.str().equals("::") && tok.previous() != null && tok.previous().isName()) {
                continue;
            }
            if (tok.strAt(-1).equals("::")) {
                continue;
            }
            boolean inStd = false;
            if (tok.str().equals("std")) {
                if (!tok.strAt(1).equals("::")) {
                    continue;
                }
                inStd = true;
            }
            Token name = tok.tokAt(tok.str().equals("std") ? 2 : tok.str().equals("::") ? 1 : 0);
            if (cpp11 && name.strAt(-1).equals("using") && name.strAt(1).equals("=")) {
                continue;
            }
            if (inStd) {
                tok.deleteNext();
                tok.deleteThis();
            } else if (tok.str().equals("::")) {
                tok.deleteThis();
            }
            tok.originalName(inStd ? "std::" + tok.str() : tok.str());
            switch (model) {
                case LONG_LONG -> {
                    tok.str("long");
                    tok.isLong(true);
                    tok.isLongLong(true);
                }
                case LONG -> {
                    tok.str("long");
                    tok.isLong(true);
                }
                case INT -> tok.str("int");
            }
            tok.isUnsigned(unsigned);
            count++;
        }
        return count;
    }

    private int simplifyAliases(Token front) {
        int count = 0;
        for (Token tok = front; tok != null; tok = tok.next()) {
            if (tok.tokType() != TokenType.NAME && tok.tokType() != TokenType.TYPE) {
                continue;
            }
            PlatformType type = platformTypes.find(tok.str(), platform.name());
            if (type == null) {
                continue;
            }
            if (tok.strAt(-1).equals("::")) {
                Token scope = tok.tokAt(-2);
                if (scope != null && scope.tokType() == TokenType.NAME) {
                    continue;
                }
                tok = tok.previous();
                tok.deleteThis();
            }
            String alias = tok.str();
            Token typeToken;
            if (type.constPtr()) {
                tok.str("const");
                tok.originalName(alias);
                tok.insertToken("*");
                typeToken = tok.insertToken(type.type());
            } else if (type.pointer()) {
                tok.str(type.type());
                typeToken = tok;
                tok.insertToken("*");
            } else if (type.ptrPtr()) {
                tok.str(type.type());
                typeToken = tok;
                tok.insertToken("*");
                tok.insertToken("*");
            } else {
                tok.str(type.type());
                typeToken = tok;
            }
            typeToken.originalName(alias);
            if (type.signed()) {
                typeToken.isSigned(true);
            }
            if (type.unsigned()) {
                typeToken.isUnsigned(true);
            }
            if (type.type().equals("long")) {
                typeToken.isLong(true);
            }
            if (type.longLong()) {
                typeToken.isLong(true);
                typeToken.isLongLong(true);
            }
            count++;
        }
        return count;
    }
}
