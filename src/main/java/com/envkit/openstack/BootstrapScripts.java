package com.envkit.openstack;

import java.util.Arrays;
import java.util.List;

public class BootstrapScripts {
    public static final String HINTS_PATH = "/etc/chef/ohai/hints";
    public static final String HINT_FILE = "openstack.json";

    // install our key, then lock the password so key auth is the only way in
    public List<String> keySetup(String publicKey, String username) {
        return Arrays.asList(
                "mkdir .ssh",
                "echo \"" + publicKey.trim() + "\" >> ~/.ssh/authorized_keys",
                "passwd -l " + username
        );
    }

    // empty marker that lets in-guest metadata tooling detect the platform without a network lookup
    public List<String> hints() {
        return Arrays.asList(
                "sudo mkdir -p " + HINTS_PATH,
                "sudo touch " + HINTS_PATH + "/" + HINT_FILE
        );
    }
}
