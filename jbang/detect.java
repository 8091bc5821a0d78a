///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//REPOS central-snapshots=https://central.sonatype.com/repository/maven-snapshots/
//DEPS org.springaicommunity:gitlab-change-detector-cli:1.0.0-SNAPSHOT

import org.springaicommunity.gitlab.detector.cli.ChangeDetectorCli;

public class detect {
    public static void main(String[] args) throws Exception {
        ChangeDetectorCli.main(args);
    }
}
