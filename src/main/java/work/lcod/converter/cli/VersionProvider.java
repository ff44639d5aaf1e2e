package work.lcod.converter.cli;

import picocli.CommandLine;
import work.lcod.converter.emit.GeneratorRegistry;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        int generators = GeneratorRegistry.standard().entries().size();
        return new String[] {
            "wf-convert (java) " + version,
            "Alteryx .yxmd to pandas, " + generators + " tool kinds with dedicated generators",
            "Java " + System.getProperty("java.version")
        };
    }
}
