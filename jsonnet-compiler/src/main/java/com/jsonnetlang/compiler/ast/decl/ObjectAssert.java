package com.jsonnetlang.compiler.ast.decl;

/**
 * 对象体内的断言
 */
public class ObjectAssert extends ObjectMember {
    private final Assertion assertion;

    public ObjectAssert(Assertion assertion) {
        super(assertion.getAssertToken());
        this.assertion = assertion;
    }

    public Assertion getAssertion() {
        return assertion;
    }

    @Override
    public MemberKind getMemberKind() {
        return MemberKind.ASSERT;
    }
}
