package com.catalogharvester.crawl.output;

/**
 * Product-import CSV columns in their fixed output order.
 */
public enum OutputColumn {
    HANDLE("Handle"),
    TITLE("Title"),
    BODY_HTML("Body (HTML)"),
    VENDOR("Vendor"),
    TYPE("Type"),
    TAGS("Tags"),
    PUBLISHED("Published"),
    OPTION1_NAME("Option1 Name"),
    OPTION1_VALUE("Option1 Value"),
    OPTION2_NAME("Option2 Name"),
    OPTION2_VALUE("Option2 Value"),
    OPTION3_NAME("Option3 Name"),
    OPTION3_VALUE("Option3 Value"),
    VARIANT_SKU("Variant SKU"),
    VARIANT_GRAMS("Variant Grams"),
    VARIANT_INVENTORY_TRACKER("Variant Inventory Tracker"),
    VARIANT_INVENTORY_QTY("Variant Inventory Qty"),
    VARIANT_INVENTORY_POLICY("Variant Inventory Policy"),
    VARIANT_FULFILLMENT_SERVICE("Variant Fulfillment Service"),
    VARIANT_PRICE("Variant Price"),
    VARIANT_COMPARE_AT_PRICE("Variant Compare At Price"),
    VARIANT_REQUIRES_SHIPPING("Variant Requires Shipping"),
    VARIANT_TAXABLE("Variant Taxable"),
    VARIANT_BARCODE("Variant Barcode"),
    IMAGE_SRC("Image Src"),
    IMAGE_POSITION("Image Position"),
    IMAGE_ALT_TEXT("Image Alt Text"),
    GIFT_CARD("Gift Card"),
    SEO_TITLE("SEO Title"),
    SEO_DESCRIPTION("SEO Description"),
    VARIANT_IMAGE("Variant Image"),
    VARIANT_WEIGHT_UNIT("Variant Weight Unit"),
    COST_PER_ITEM("Cost per item"),
    STATUS("Status"),
    COMPATIBLE_MAKES("Metafield: custom.car_make [list.single_line_text_field]"),
    COMPATIBLE_YEARS("Metafield: custom.car_year [list.single_line_text_field]");

    private final String header;

    OutputColumn(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }

    public boolean isImageSlot() {
        return this == IMAGE_SRC || this == IMAGE_POSITION || this == IMAGE_ALT_TEXT;
    }

    public static String[] headers() {
        OutputColumn[] columns = values();
        String[] headers = new String[columns.length];
        for (int i = 0; i < columns.length; i++) {
            headers[i] = columns[i].header;
        }
        return headers;
    }
}
