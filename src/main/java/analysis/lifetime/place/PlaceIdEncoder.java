package analysis.lifetime.place;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Projection;
import analysis.lifetime.ir.Variable;

/**
 * Turns places of one function body into canonical {@link PlaceId}s and answers storage questions about them
 */
public class PlaceIdEncoder {

    private final FunctionBody body;
    /**
     * Memoized encodings
     */
    private final ConcurrentMap<Place, PlaceId> cache = new ConcurrentHashMap<>();

    /**
     * Create an encoder for the places of a function body
     *
     * @param body
     *            body whose variable declarations are consulted
     */
    public PlaceIdEncoder(FunctionBody body) {
        this.body = body;
    }

    /**
     * Full (projection-aware) id of a place
     *
     * @param p
     *            place to encode
     * @return canonical id
     */
    public PlaceId encode(Place p) {
        PlaceId id = cache.get(p);
        if (id == null) {
            id = encode(p.getBase(), p.getProjections());
            PlaceId existing = cache.putIfAbsent(p, id);
            if (existing != null) {
                id = existing;
            }
        }
        return id;
    }

    /**
     * Id of the base variable of a place, ignoring its projections
     *
     * @param p
     *            place
     * @return id of the base variable
     */
    public PlaceId baseId(Place p) {
        return PlaceId.of(p.getBase());
    }

    /**
     * Encode a base variable and a list of projections. A dereference is a prefix dereference when it is the first
     * projection or follows a prefix dereference, otherwise it is a suffix dereference.
     *
     * @param base
     *            name of the base variable
     * @param projections
     *            projections, in order of application
     * @return canonical id
     */
    public static PlaceId encode(String base, List<Projection> projections) {
        List<PlaceId.Element> elements = new ArrayList<>(projections.size());
        // still inside the leading run of dereferences
        boolean prefixRun = true;
        for (Projection p : projections) {
            switch (p.getKind()) {
            case DEREF:
                if (prefixRun) {
                    elements.add(new PlaceId.Element(PlaceId.ElementKind.PREFIX_DEREF, -1));
                } else {
                    elements.add(new PlaceId.Element(PlaceId.ElementKind.SUFFIX_DEREF, -1));
                }
                break;
            case FIELD:
                prefixRun = false;
                elements.add(new PlaceId.Element(PlaceId.ElementKind.FIELD, p.getIndex()));
                break;
            case DOWNCAST:
                prefixRun = false;
                elements.add(new PlaceId.Element(PlaceId.ElementKind.DOWNCAST, p.getIndex()));
                break;
            default:
                throw new RuntimeException("Unhandled projection " + p.getKind());
            }
        }
        return new PlaceId(base, elements);
    }

    /**
     * Whether the base variable of the place has static storage duration
     *
     * @param p
     *            place to check
     * @return true if the base is a static item
     * @throws analysis.lifetime.ir.MalformedBodyException
     *             if the base is not declared
     */
    public boolean isStatic(Place p) {
        return body.getVariable(p.getBase()).isStatic();
    }

    /**
     * Whether the place has raw-pointer type
     *
     * @param p
     *            place to check
     * @return true if the declared type of the place is a raw pointer
     */
    public boolean isRawPointer(Place p) {
        return body.typeOf(p).isRawPointer();
    }

    /**
     * Declaration of the base of a place
     *
     * @param p
     *            place
     * @return declared variable
     */
    public Variable getBaseVariable(Place p) {
        return body.getVariable(p.getBase());
    }

    public FunctionBody getBody() {
        return body;
    }
}
