package com.envkit.openstack;

import com.envkit.devops.NamedResource;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps an image/flavor/network reference to a provider id. A reference is tried as an exact id, then as an
 * exact name, then, when written as {@code /regex/}, as a pattern searched in the names. The first candidate in
 * listing order wins. Anything unmatched is handed back untouched; the provider may still know it as a raw id.
 */
public class ReferenceResolver {
    final static Logger LOG = LogManager.getLogger(ReferenceResolver.class);

    public String resolve(String reference, List<NamedResource> candidates) {
        if (reference == null) {
            return null;
        }
        for (NamedResource candidate : candidates) {
            if (reference.equals(candidate.getId())) {
                return candidate.getId();
            }
        }
        for (NamedResource candidate : candidates) {
            if (reference.equals(candidate.getName())) {
                LOG.debug("Resolved name " + reference + " to " + candidate.getId());
                return candidate.getId();
            }
        }
        Pattern pattern = asPattern(reference);
        if (pattern != null) {
            for (NamedResource candidate : candidates) {
                if (candidate.getName() != null && pattern.matcher(candidate.getName()).find()) {
                    LOG.debug("Resolved " + reference + " to " + candidate);
                    return candidate.getId();
                }
            }
        }
        LOG.info("No match for " + reference + " among " + candidates.size() + " candidates, passing it through");
        return reference;
    }

    // null unless the reference is written /like this/
    static Pattern asPattern(String reference) {
        if (reference.length() < 2 || !reference.startsWith("/") || !reference.endsWith("/")) {
            return null;
        }
        try {
            return Pattern.compile(reference.substring(1, reference.length() - 1));
        } catch (PatternSyntaxException e) {
            LOG.warn("Invalid regular expression " + reference + ": " + e.getDescription());
            return null;
        }
    }
}
