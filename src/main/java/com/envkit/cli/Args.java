package com.envkit.cli;

import com.beust.jcommander.Parameter;

import java.util.ArrayList;
import java.util.List;

class Args {
    // command line parsing: see http://jcommander.org/#_overview
    @Parameter(description = "create | destroy")
    public List<String> actions = new ArrayList<>();
    @Parameter(names = {"-p","--properties"}, description = "Driver settings (java.util.Properties format)", required = true)
    public String propertiesFile = null;
    @Parameter(names = {"-s","--state"}, description = "Instance state file (JSON), created if missing")
    public String stateFile = ".kitchen/default.json";
    @Parameter(names = {"-n","--name"}, description = "Instance name, used as the base of generated server names")
    public String instanceName = "default";
    @Parameter(names = {"-d","--debug"}, description = "Log at DEBUG level")
    public boolean debug = false;
    @Parameter(names = {"-?","--help"}, help = true, description = "Print this message")
    public boolean help;
}
