package org.kryon.expr.backend.bytecode;

/**
 * Bytecode opcodes for the expression VM.
 *
 * Design: stack machine. Every instruction is one packed {@code long}
 * (see {@link Instruction}): an 8-bit opcode, an 8-bit flag byte (operand1),
 * an unsigned 16-bit pool index (operand2) and a signed 32-bit immediate or
 * PC-relative jump offset (operand3).
 *
 * Keep opcodes CONTIGUOUS: the interpreter's dispatch switch compiles to a
 * tableswitch only while the range is dense.
 */
public class Opcodes {
    // =================================================================
    // CONSTANTS (0-5)
    // =================================================================

    /** No operation. Dead-code elimination writes these over unreachable slots */
    public static final int NOP = 0;

    /** Push integer: op3 inline, or integer pool[op2] when op1 == 1 */
    public static final int PUSH_INT = 1;

    /** Push float parsed from string pool[op2] */
    public static final int PUSH_FLOAT = 2;

    /** Push string pool[op2] */
    public static final int PUSH_STRING = 3;

    /** Push op1 != 0 */
    public static final int PUSH_BOOL = 4;

    public static final int PUSH_NULL = 5;

    // =================================================================
    // STACK MANIPULATION (6-8)
    // =================================================================

    public static final int DUP = 6;
    public static final int POP = 7;
    public static final int SWAP = 8;

    // =================================================================
    // VARIABLES AND MEMBER ACCESS (9-12)
    // =================================================================

    /** Push copy of variable string pool[op2]: locals first, then the accessor */
    public static final int LOAD_VAR = 9;

    /** obj = pop; push obj.(string pool[op2]) */
    public static final int GET_PROP = 10;

    /** key = pop; obj = pop; push obj[key] */
    public static final int GET_PROP_COMPUTED = 11;

    /** index = pop; arr = pop; push arr[index] */
    public static final int GET_INDEX = 12;

    // =================================================================
    // CALLS (13-15): op2 = name in string pool, op3 = argc
    // =================================================================

    /** args = pop op3 values; receiver = pop; push receiver.name(args) */
    public static final int CALL_METHOD = 13;

    /** args = pop op3 values; push registry(name)(args) */
    public static final int CALL_BUILTIN = 14;

    /** args = pop op3 values; push null */
    public static final int CALL_FUNCTION = 15;

    // =================================================================
    // ARITHMETIC (16-21): right = pop; left = pop; push left op right
    // =================================================================

    public static final int ADD = 16;
    public static final int SUB = 17;
    public static final int MUL = 18;
    public static final int DIV = 19;
    public static final int MOD = 20;

    /** Stringify both operands and concatenate */
    public static final int CONCAT = 21;

    // =================================================================
    // COMPARISON AND LOGIC (22-32)
    // =================================================================

    public static final int EQ = 22;
    public static final int NEQ = 23;
    public static final int LT = 24;
    public static final int LTE = 25;
    public static final int GT = 26;
    public static final int GTE = 27;
    public static final int AND = 28;
    public static final int OR = 29;
    public static final int NOT = 30;
    public static final int NEGATE = 31;

    /** Push the type name of the popped value */
    public static final int TYPEOF = 32;

    // =================================================================
    // CONTROL FLOW (33-35): target = pc + op3
    // =================================================================

    public static final int JUMP = 33;

    /** cond = pop; if (!cond) pc += op3 */
    public static final int JUMP_IF_FALSE = 34;

    /** cond = pop; if (cond) pc += op3 */
    public static final int JUMP_IF_TRUE = 35;

    // =================================================================
    // CONTAINERS (36-37)
    // =================================================================

    /** Pop op3 elements (last on top) into a new array */
    public static final int MAKE_ARRAY = 36;

    /** Pop op3 key/value pairs (key pushed first) into a new object */
    public static final int MAKE_OBJECT = 37;

    public static final int HALT = 38;

    private static final String[] NAMES = {
            "NOP", "PUSH_INT", "PUSH_FLOAT", "PUSH_STRING", "PUSH_BOOL", "PUSH_NULL",
            "DUP", "POP", "SWAP",
            "LOAD_VAR", "GET_PROP", "GET_PROP_COMPUTED", "GET_INDEX",
            "CALL_METHOD", "CALL_BUILTIN", "CALL_FUNCTION",
            "ADD", "SUB", "MUL", "DIV", "MOD", "CONCAT",
            "EQ", "NEQ", "LT", "LTE", "GT", "GTE", "AND", "OR", "NOT", "NEGATE", "TYPEOF",
            "JUMP", "JUMP_IF_FALSE", "JUMP_IF_TRUE",
            "MAKE_ARRAY", "MAKE_OBJECT",
            "HALT"
    };

    private Opcodes() {
    }

    /**
     * @return the mnemonic, or {@code UNKNOWN(n)} for an opcode outside the set
     */
    public static String name(int opcode) {
        if (opcode >= 0 && opcode < NAMES.length) {
            return NAMES[opcode];
        }
        return "UNKNOWN(" + opcode + ")";
    }

    /**
     * Net operand stack effect of one instruction.
     *
     * @param opcode the opcode
     * @param op3    operand3 (argument or element count where relevant)
     */
    public static int stackEffect(int opcode, int op3) {
        switch (opcode) {
            case PUSH_INT:
            case PUSH_FLOAT:
            case PUSH_STRING:
            case PUSH_BOOL:
            case PUSH_NULL:
            case DUP:
            case LOAD_VAR:
                return 1;
            case POP:
            case GET_PROP_COMPUTED:
            case GET_INDEX:
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case CONCAT:
            case EQ:
            case NEQ:
            case LT:
            case LTE:
            case GT:
            case GTE:
            case AND:
            case OR:
            case JUMP_IF_FALSE:
            case JUMP_IF_TRUE:
                return -1;
            case CALL_METHOD:
                // receiver and args in, result out
                return -op3;
            case CALL_BUILTIN:
            case CALL_FUNCTION:
            case MAKE_ARRAY:
                return 1 - op3;
            case MAKE_OBJECT:
                return 1 - 2 * op3;
            default:
                // NOP SWAP GET_PROP NOT NEGATE TYPEOF JUMP HALT
                return 0;
        }
    }
}
