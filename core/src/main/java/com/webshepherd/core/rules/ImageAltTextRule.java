package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;

/**
 * 1.1.1 Non-text Content: img 에 alt 속성이 아예 없으면 위반.
 * alt="" 는 장식 이미지 표시이므로 통과.
 */
public final class ImageAltTextRule extends AbstractRule {

    public static final String CODE = "IMG_ALT_MISSING";

    public ImageAltTextRule() {
        super(CODE, "1.1.1", WcagLevel.AA, Principle.PERCEIVABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        int missing = 0;
        String first = null;
        for (HtmlElement img : doc.images()) {
            if (img.hasAttr("alt")) continue;
            if (missing++ == 0) first = img.snippet();
        }
        if (missing > 0) {
            return List.of(finding(Severity.FAIL,
                    missing + " images missing alt attribute",
                    "Add descriptive alt text to all images. Use alt='' for decorative images.",
                    first, missing));
        }
        return List.of(pass("All images have alt attributes"));
    }
}
