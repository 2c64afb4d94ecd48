package com.order.consolidation.pattern;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled regex families used by {@link PatternDetector}.
 * Built once and never mutated, so a table can be shared by any number of detectors.
 *
 * @param strongIntent   phrases that clearly ask for goods ("quiero", "send me")
 * @param mediumIntent   weaker hints such as a bare quantity or an availability question
 * @param closing        phrases ending an order ("eso es todo", "gracias")
 * @param correction     phrases changing earlier items ("en vez de", "no quiero")
 * @param quantity       quantity with an optional unit
 * @param product        product lexicon
 * @param itemExtraction quantity, optional unit and trailing product phrase, in groups 1 to 3
 */
public record PatternTables(
        List<Pattern> strongIntent,
        List<Pattern> mediumIntent,
        List<Pattern> closing,
        List<Pattern> correction,
        List<Pattern> quantity,
        List<Pattern> product,
        Pattern itemExtraction
) {
    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final String UNITS = "kilos?|kg|gramos?|gr?|libras?|lbs?"
            + "|litros?|lt?|mililitros?|ml"
            + "|cajas?|boxes?|paquetes?|packages?"
            + "|botellas?|bottles?|envases?|containers?"
            + "|unidades?|units?|piezas?|pieces?"
            + "|docenas?|dozens?";

    private static final List<String> STRONG_INTENT = List.of(
            "\\b(quiero|necesito|dame|pídeme|ordeno|envíame|mándame)\\b",
            "\\b(i want|i need|give me|send me|order|i'll take)\\b",
            "\\b(me das|me traes|me vendes|me mandas)\\b",
            "\\b(can you send|could you send|please send)\\b",
            "\\b(voy a pedir|quiero pedir|necesito pedir)\\b",
            "\\b(going to order|want to order|need to order)\\b"
    );

    private static final List<String> MEDIUM_INTENT = List.of(
            "\\b(\\d+)\\s*(de|of|x)?\\s*([\\w\\s]+)",
            "\\b(cuánto|precio|cuesta|cost|price|how much)\\b.*\\b(de|of|for)\\b",
            "\\b(disponible|available|tienes|do you have)\\b",
            "\\b(me interesa|estoy interesado|interested in)\\b"
    );

    private static final List<String> CLOSING = List.of(
            "\\b(eso es todo|that's all|that's it|nada más|nothing else)\\b",
            "\\b(sería todo|would be all|eso sería todo)\\b",
            "\\b(gracias|thanks|thank you|muchas gracias)\\b",
            "\\b(confirma|confirm|confirmado|confirmed)\\b",
            "\\b(listo|ready|ok|okay|perfecto|perfect)\\b",
            "\\b(envía|send it|mándalo|go ahead)\\b",
            "\\b(ya está|that's done|terminamos|we're done)\\b"
    );

    private static final List<String> CORRECTION = List.of(
            "\\b(no[,\\s]+(mejor|actually|en realidad|instead))\\b",
            "\\b(cambio|change|corrección|correction|rectificación)\\b",
            "\\b(en vez de|instead of|mejor que|rather than)\\b",
            "\\b(me equivoqué|i made a mistake|error|wrong)\\b",
            "\\b(no quiero|i don't want|cancel|cancela)\\b",
            "\\b(son|it's|serían|would be)\\s+(\\d+)"
    );

    private static final List<String> QUANTITY = List.of(
            "\\b(\\d+(?:\\.\\d+)?)\\s*(kilos?|kg|gramos?|gr?|libras?|lbs?)\\b",
            "\\b(\\d+(?:\\.\\d+)?)\\s*(litros?|lt?|mililitros?|ml)\\b",
            "\\b(\\d+(?:\\.\\d+)?)\\s*(cajas?|boxes?|paquetes?|packages?)\\b",
            "\\b(\\d+(?:\\.\\d+)?)\\s*(botellas?|bottles?|envases?|containers?)\\b",
            "\\b(\\d+(?:\\.\\d+)?)\\s*(unidades?|units?|piezas?|pieces?)\\b",
            "\\b(\\d+(?:\\.\\d+)?)\\s*(docenas?|dozens?)\\b",
            "(\\d+(?:\\.\\d+)?)\\s*([\\w\\s]+)"
    );

    private static final List<String> PRODUCT = List.of(
            "\\b(coca cola|cocas?|coke|pepsis?|sprites?|fantas?|aguas?|water|jugos?|juices?|cervezas?|beers?)\\b",
            "\\b(pan|panes|bread|leches?|milk|quesos?|cheeses?|huevos?|eggs?|arroz|rice|frijol(?:es)?|beans)\\b",
            "\\b(papas|chips|galletas?|cookies?|dulces?|candy|candies|chocolates?)\\b",
            "\\b(comida|food|bebidas?|drinks?|snacks?|botanas?)\\b"
    );

    private static final String ITEM_EXTRACTION =
            "(\\d+(?:\\.\\d+)?)\\s*(?:(" + UNITS + ")\\b)?\\s*(\\p{L}[\\p{L}\\s]*)";

    public PatternTables {
        strongIntent = List.copyOf(strongIntent);
        mediumIntent = List.copyOf(mediumIntent);
        closing = List.copyOf(closing);
        correction = List.copyOf(correction);
        quantity = List.copyOf(quantity);
        product = List.copyOf(product);
        if (itemExtraction == null) {
            throw new IllegalArgumentException("itemExtraction pattern is required");
        }
    }

    /**
     * The Spanish and English tables for grocery and beverage orders.
     */
    public static PatternTables defaults() {
        return new PatternTables(
                compileAll(STRONG_INTENT),
                compileAll(MEDIUM_INTENT),
                compileAll(CLOSING),
                compileAll(CORRECTION),
                compileAll(QUANTITY),
                compileAll(PRODUCT),
                Pattern.compile(ITEM_EXTRACTION, FLAGS)
        );
    }

    static List<Pattern> compileAll(List<String> expressions) {
        return expressions.stream()
                .map(expression -> Pattern.compile(expression, FLAGS))
                .toList();
    }
}
