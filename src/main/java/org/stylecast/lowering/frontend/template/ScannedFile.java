package org.stylecast.lowering.frontend.template;

import java.util.List;

/**
 * The result of scanning a file.
 *
 * @param components Styled components in source order.
 * @param scope      File-level facts.
 */
public record ScannedFile(List<StyledComponentSource> components, FileScope scope) {
    public ScannedFile {
        components = List.copyOf(components);
    }
}
