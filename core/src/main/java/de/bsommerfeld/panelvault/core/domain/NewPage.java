package de.bsommerfeld.panelvault.core.domain;

import java.util.List;

/**
 * A page ready to be inserted by a commit batch, with its index already
 * assigned. Images are stored with 0-based indices in list order.
 */
public record NewPage(int index, String title, String url, List<String> imageUrls) {

    public NewPage {
        imageUrls = List.copyOf(imageUrls);
    }
}
