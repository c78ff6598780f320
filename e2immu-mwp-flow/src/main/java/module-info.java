module org.e2immu.analyzer.mwp.flow {
    requires transitive org.e2immu.analyzer.mwp.common;
    requires transitive org.e2immu.analyzer.mwp.prepwork;
    requires org.slf4j;

    exports org.e2immu.analyzer.mwp.flow;
    exports org.e2immu.analyzer.mwp.flow.bound;
    exports org.e2immu.analyzer.mwp.flow.choice;
    exports org.e2immu.analyzer.mwp.flow.impl;
    exports org.e2immu.analyzer.mwp.flow.semiring;
}
