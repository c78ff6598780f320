module org.e2immu.analyzer.mwp.common {
    exports org.e2immu.analyzer.mwp.common;
    exports org.e2immu.analyzer.mwp.common.cst;
}
