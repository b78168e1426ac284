package com.jsonnetlang.ir.lowering;

/**
 * 脱糖改写所调用的标准库函数名
 */
public final class StdlibNames {

    private StdlibNames() {}

    /** 标准库对象的变量名 */
    public static final String STD = "std";

    /** std.equals(a, b)：a == b */
    public static final String EQUALS = "equals";

    /** std.mod(a, b)：a % b */
    public static final String MOD = "mod";

    /** std.slice(e, from, to, step)：e[from:to:step] */
    public static final String SLICE = "slice";

    /** std.objectHasEx(obj, key, includeHidden)：key in obj */
    public static final String OBJECT_HAS_EX = "objectHasEx";
}
