module org.e2immu.analyzer.mwp.prepwork {
    requires transitive org.e2immu.analyzer.mwp.common;
    requires org.slf4j;

    exports org.e2immu.analyzer.mwp.prepwork;
}
