package io.doncoin.indexer.session;

public class DeploymentNotFoundException extends RuntimeException {

    private final String contractAddress;

    public DeploymentNotFoundException(String contractName, String contractAddress) {
        super("No contract code found for " + contractName + " at " + contractAddress);
        this.contractAddress = contractAddress;
    }

    public String contractAddress() {
        return contractAddress;
    }
}
