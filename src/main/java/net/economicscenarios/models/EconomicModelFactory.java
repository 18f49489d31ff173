package net.economicscenarios.models;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.economicscenarios.models.equity.BlackScholesMerton;
import net.economicscenarios.models.equity.ConstantElasticityOfVariance;
import net.economicscenarios.models.interestrate.CoxIngersollRoss;
import net.economicscenarios.models.interestrate.Vasicek;

/**
 * Creates models from a property map.
 *
 * The key <code>model</code> selects the model (case insensitive, see {@link ModelType}); the remaining keys
 * carry the parameters, given as {@link Number} or as a numeric {@link String}:
 * <ul>
 * 		<li><code>VASICEK</code>, <code>COXINGERSOLLROSS</code>: <code>meanReversionSpeed</code>, <code>longTermMean</code>, <code>volatility</code>, <code>initialValue</code></li>
 * 		<li><code>BLACKSCHOLESMERTON</code>: <code>riskFreeRate</code>, <code>dividendYield</code>, <code>volatility</code>, <code>initialValue</code></li>
 * 		<li><code>CONSTANTELASTICITYOFVARIANCE</code>: as above, plus <code>elasticity</code></li>
 * </ul>
 * {@link net.economicscenarios.models.interestrate.HullWhite} requires a discount curve and cannot be created from properties.
 */
public class EconomicModelFactory {

    private static final Logger logger = LogManager.getLogger(EconomicModelFactory.class);

    public enum ModelType { VASICEK, COXINGERSOLLROSS, BLACKSCHOLESMERTON, CONSTANTELASTICITYOFVARIANCE }

    private EconomicModelFactory() {
    }

    public static EconomicModelInterface createModel(Map<String, ?> properties) {
        if(properties == null || !properties.containsKey("model")) {
            throw new IllegalArgumentException("Property 'model' is required to create an economic model.");
        }

        ModelType modelType;
        try {
            modelType = ModelType.valueOf(properties.get("model").toString().toUpperCase());
        }
        catch(IllegalArgumentException e) {
            throw new IllegalArgumentException("Model type " + properties.get("model") + " not supported.", e);
        }

        EconomicModelInterface model;
        switch (modelType) {
            case VASICEK:
                model = new Vasicek(
                        getParameter(properties, "meanReversionSpeed"),
                        getParameter(properties, "longTermMean"),
                        getParameter(properties, "volatility"),
                        getParameter(properties, "initialValue"));
                break;
            case COXINGERSOLLROSS:
                model = new CoxIngersollRoss(
                        getParameter(properties, "meanReversionSpeed"),
                        getParameter(properties, "longTermMean"),
                        getParameter(properties, "volatility"),
                        getParameter(properties, "initialValue"));
                break;
            case BLACKSCHOLESMERTON:
                model = new BlackScholesMerton(
                        getParameter(properties, "riskFreeRate"),
                        getParameter(properties, "dividendYield"),
                        getParameter(properties, "volatility"),
                        getParameter(properties, "initialValue"));
                break;
            case CONSTANTELASTICITYOFVARIANCE:
                model = new ConstantElasticityOfVariance(
                        getParameter(properties, "riskFreeRate"),
                        getParameter(properties, "dividendYield"),
                        getParameter(properties, "volatility"),
                        getParameter(properties, "elasticity"),
                        getParameter(properties, "initialValue"));
                break;
            default:
                throw new IllegalArgumentException("Model type " + modelType + " not supported.");
        }

        logger.debug("Created {} from properties", model);
        return model;
    }

    /**
     * Reads a numeric property.
     *
     * @param properties The property map.
     * @param key The key.
     * @return The value as double.
     * @throws IllegalArgumentException If the key is missing or its value is not numeric.
     */
    public static double getParameter(Map<String, ?> properties, String key) {
        Object value = properties.get(key);
        if(value == null) {
            throw new IllegalArgumentException("Property '" + key + "' is required.");
        }
        if(value instanceof Number) {
            return ((Number)value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        }
        catch(NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not numeric: " + value, e);
        }
    }
}
