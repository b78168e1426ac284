package com.jsonnetlang.compiler.ast.expr;

import com.jsonnetlang.compiler.ast.AstVisitor;
import com.jsonnetlang.compiler.lexer.Token;

/**
 * 导入表达式 import "path" / importstr "path"
 */
public class ImportExpr extends Expression {
    private final ImportKind kind;
    private final Literal path;

    public ImportExpr(Token importToken, ImportKind kind, Literal path) {
        super(importToken);
        this.kind = kind;
        this.path = path;
    }

    public ImportKind getKind() {
        return kind;
    }

    public Literal getPath() {
        return path;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportExpr(this, context);
    }

    public enum ImportKind {
        IMPORT("import"),
        IMPORTSTR("importstr");

        private final String keyword;

        ImportKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
