package fsmgen.ir;

/** Direction of a port as seen from outside of its cell. */
public enum Direction { Input, Output, Inout }
