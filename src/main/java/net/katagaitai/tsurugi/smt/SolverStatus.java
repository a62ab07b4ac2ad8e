package net.katagaitai.tsurugi.smt;

import com.microsoft.z3.Status;

public enum SolverStatus {
    SAT,
    UNSAT,
    UNKNOWN;

    public static SolverStatus of(Status status) {
        if (status == null) {
            return UNKNOWN;
        }
        switch (status) {
            case SATISFIABLE:
                return SAT;
            case UNSATISFIABLE:
                return UNSAT;
            default:
                return UNKNOWN;
        }
    }
}
